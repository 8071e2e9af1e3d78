package com.ryuqq.shopstore.application.manager;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ListShopsOptions 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ListShopsOptionsTest {

    @Test
    void 기본값() {
        // when
        ListShopsOptions options = new ListShopsOptions();

        // then
        assertThat(options.owner()).isNull();
        assertThat(options.hasOwnerFilter()).isFalse();
        assertThat(options.limit()).isEqualTo(ListShopsOptions.DEFAULT_LIMIT);
        assertThat(options.offset()).isZero();
        assertThat(options.sortBy()).isEqualTo(SortField.NAME);
        assertThat(options.descending()).isFalse();
    }

    @Test
    void with_메서드는_해당_필드만_바꾼_새_인스턴스를_반환함() {
        // given
        ListShopsOptions base = new ListShopsOptions();

        // when
        ListShopsOptions changed = base.withOwner("0xABC").withLimit(10).withOffset(20)
            .withSortBy(SortField.ID).withDescending(true);

        // then
        assertThat(changed).isEqualTo(new ListShopsOptions("0xABC", 10, 20, SortField.ID, true));
        assertThat(changed.hasOwnerFilter()).isTrue();
        assertThat(base).isEqualTo(new ListShopsOptions());
    }

    @Test
    void 음수_limit_offset과_null_sortBy는_거부함() {
        assertThatThrownBy(() -> new ListShopsOptions().withLimit(-1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("limit");
        assertThatThrownBy(() -> new ListShopsOptions().withOffset(-1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("offset");
        assertThatThrownBy(() -> new ListShopsOptions().withSortBy(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("sortBy");
    }
}
