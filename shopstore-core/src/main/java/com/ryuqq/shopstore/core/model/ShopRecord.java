package com.ryuqq.shopstore.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * 상점 레코드 (가변 엔티티).
 *
 * <p>호출자, 캐시, 백엔드가 같은 인스턴스를 공유하지 않도록
 * 경계를 넘을 때마다 {@link #copy()}로 깊은 복사를 합니다.</p>
 *
 * <p><strong>불변식:</strong> 영속화 전에 id, owner, name이 비어 있지 않아야 합니다
 * ({@link ShopRecordValidator}).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ShopRecord {

    private String id;
    private String owner;
    private String name;
    private String description;
    private Instant created;
    private Instant updated;
    private ShopContent content;
    private ShopAssets assets;
    private String storageAddress;

    public ShopRecord() {
        this.content = new ShopContent();
        this.assets = new ShopAssets();
    }

    /**
     * 필수 필드만 채운 레코드 생성.
     */
    public static ShopRecord of(String id, String owner, String name) {
        ShopRecord record = new ShopRecord();
        record.id = id;
        record.owner = owner;
        record.name = name;
        return record;
    }

    /**
     * 깊은 복사.
     *
     * <p>반환된 레코드의 어떤 필드(상품 리스트, 이미지 참조 리스트 포함)를 바꿔도
     * 원본에 영향을 주지 않습니다.</p>
     */
    public ShopRecord copy() {
        ShopRecord copy = new ShopRecord();
        copy.id = id;
        copy.owner = owner;
        copy.name = name;
        copy.description = description;
        copy.created = created;
        copy.updated = updated;
        copy.content = content == null ? null : content.copy();
        copy.assets = assets == null ? null : assets.copy();
        copy.storageAddress = storageAddress;
        return copy;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getOwner() {
        return owner;
    }

    public void setOwner(String owner) {
        this.owner = owner;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public Instant getCreated() {
        return created;
    }

    public void setCreated(Instant created) {
        this.created = created;
    }

    public Instant getUpdated() {
        return updated;
    }

    public void setUpdated(Instant updated) {
        this.updated = updated;
    }

    public ShopContent getContent() {
        return content;
    }

    public void setContent(ShopContent content) {
        this.content = content;
    }

    public ShopAssets getAssets() {
        return assets;
    }

    public void setAssets(ShopAssets assets) {
        this.assets = assets;
    }

    public String getStorageAddress() {
        return storageAddress;
    }

    public void setStorageAddress(String storageAddress) {
        this.storageAddress = storageAddress;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ShopRecord that = (ShopRecord) o;
        return Objects.equals(id, that.id)
            && Objects.equals(owner, that.owner)
            && Objects.equals(name, that.name)
            && Objects.equals(description, that.description)
            && Objects.equals(created, that.created)
            && Objects.equals(updated, that.updated)
            && Objects.equals(content, that.content)
            && Objects.equals(assets, that.assets)
            && Objects.equals(storageAddress, that.storageAddress);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, owner, name, description, created, updated, content, assets, storageAddress);
    }

    @Override
    public String toString() {
        return "ShopRecord{id=" + id + ", owner=" + owner + ", name=" + name + '}';
    }
}
