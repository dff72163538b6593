package io.github.crmrecords.util;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CheckerTest {

    @Test
    void check_should_work() {
        Checker.check(true, "never thrown");
        assertThatThrownBy(() -> Checker.check(false, "limit should be >= -1"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("limit should be >= -1");
    }

    @Test
    void checkNotNull_and_checkNotBlank_should_return_target() {
        assertThat(Checker.checkNotNull(1, "count")).isEqualTo(1);
        assertThat(Checker.checkNotBlank("memory", "storeType")).isEqualTo("memory");

        assertThatThrownBy(() -> Checker.checkNotNull(null, "store")).hasMessage("store should not be null");
        assertThatThrownBy(() -> Checker.checkNotBlank(" ", "storeName")).hasMessage("storeName should be non-blank");
    }

    @Test
    void checkNoNullElement_should_work() {
        assertThat(Checker.checkNoNullElement(List.of(), "records")).isEmpty();

        var list = new ArrayList<String>();
        list.add("a");
        list.add(null);
        assertThatThrownBy(() -> Checker.checkNoNullElement(list, "records"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("records should not contain null element");
        assertThatThrownBy(() -> Checker.checkNoNullElement(null, "records"))
                .hasMessage("records should not be null");
    }
}
