package com.ryuqq.shopstore.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 상점 본문: 상품 목록, 테마, 연락처.
 *
 * <p>상품 목록은 순서를 유지하는 가변 리스트입니다.
 * {@link LineItem}, {@link ThemeColors}, {@link ContactInfo}는 불변이므로
 * {@link #copy()}는 리스트만 새로 만들면 깊은 복사가 됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ShopContent {

    private final List<LineItem> items;
    private ThemeColors theme;
    private ContactInfo contact;

    public ShopContent() {
        this(List.of(), ThemeColors.DEFAULT, ContactInfo.EMPTY);
    }

    public ShopContent(List<LineItem> items, ThemeColors theme, ContactInfo contact) {
        this.items = items == null ? new ArrayList<>() : new ArrayList<>(items);
        this.theme = theme;
        this.contact = contact;
    }

    /**
     * 상품 목록 (변경 가능한 내부 리스트).
     */
    public List<LineItem> getItems() {
        return items;
    }

    public ThemeColors getTheme() {
        return theme;
    }

    public void setTheme(ThemeColors theme) {
        this.theme = theme;
    }

    public ContactInfo getContact() {
        return contact;
    }

    public void setContact(ContactInfo contact) {
        this.contact = contact;
    }

    public ShopContent copy() {
        return new ShopContent(items, theme, contact);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ShopContent that = (ShopContent) o;
        return items.equals(that.items)
            && Objects.equals(theme, that.theme)
            && Objects.equals(contact, that.contact);
    }

    @Override
    public int hashCode() {
        return Objects.hash(items, theme, contact);
    }
}
