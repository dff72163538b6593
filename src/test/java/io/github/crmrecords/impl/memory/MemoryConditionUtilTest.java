package io.github.crmrecords.impl.memory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.Lists;
import io.github.crmrecords.RecordException;
import io.github.crmrecords.condition.Condition;
import io.github.crmrecords.schema.RecordType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MemoryConditionUtilTest {

    static Map<String, Object> row(String id, String name, Integer amount) {
        var row = new HashMap<String, Object>();
        row.put("Id", id);
        row.put("Name", name);
        row.put("Amount", amount);
        return row;
    }

    static List<Map<String, Object>> rows() {
        return Lists.newArrayList(
                row("1", "Charlie", 30),
                row("2", "Alpha", null),
                row("3", "Bravo", 10),
                row("4", "Alpha", 20));
    }

    @Test
    void checkFields_should_work() {
        MemoryConditionUtil.checkFields(RecordType.OPPORTUNITY, Condition.filter("Id", "x", "Amount >", 1).sort("CloseDate", "ASC"));

        assertThatThrownBy(() -> MemoryConditionUtil.checkFields(RecordType.OPPORTUNITY, Condition.filter("Company", "x")))
                .isInstanceOfSatisfying(RecordException.class, re -> {
                    assertThat(re.getStatusCode()).isEqualTo(400);
                    assertThat(re.getMessage()).contains("No such field Company on Opportunity");
                });
    }

    @Test
    void filter_should_keep_order() {
        var result = MemoryConditionUtil.filter(rows(), Condition.filter("Name", "Alpha"));
        assertThat(result).extracting(r -> r.get("Id")).containsExactly("2", "4");

        assertThat(MemoryConditionUtil.filter(rows(), new Condition())).hasSize(4);
        assertThat(MemoryConditionUtil.filter(new ArrayList<>(), Condition.filter("Name", "Alpha"))).isEmpty();
    }

    @Test
    void apply_should_sort_with_null_first() {
        var asc = MemoryConditionUtil.apply(rows(), Condition.filter().sort("Amount", "ASC"));
        assertThat(asc).extracting(r -> r.get("Id")).containsExactly("2", "3", "4", "1");

        var desc = MemoryConditionUtil.apply(rows(), Condition.filter().sort("Amount", "DESC"));
        assertThat(desc).extracting(r -> r.get("Id")).containsExactly("1", "4", "3", "2");

        var multi = MemoryConditionUtil.apply(rows(), Condition.filter().sort("Name", "ASC", "Amount", "DESC"));
        assertThat(multi).extracting(r -> r.get("Id")).containsExactly("4", "2", "3", "1");
    }

    @Test
    void apply_should_page() {
        var cond = Condition.filter().sort("Name", "ASC").offset(1).limit(2);
        assertThat(MemoryConditionUtil.apply(rows(), cond)).extracting(r -> r.get("Id")).containsExactly("4", "3");

        assertThat(MemoryConditionUtil.apply(rows(), Condition.filter().offset(3))).hasSize(1);
        assertThat(MemoryConditionUtil.apply(rows(), Condition.filter().offset(5))).isEmpty();
        assertThat(MemoryConditionUtil.apply(rows(), Condition.filter().limit(0))).isEmpty();
    }

    @Test
    void apply_should_accept_limit_up_to_max_int_with_offset() {
        var cond = Condition.filter().offset(1).limit(Integer.MAX_VALUE);
        assertThat(MemoryConditionUtil.apply(rows(), cond)).extracting(r -> r.get("Id")).containsExactly("2", "3", "4");

        var sorted = Condition.filter().sort("Name", "ASC").offset(3).limit(Integer.MAX_VALUE);
        assertThat(MemoryConditionUtil.apply(rows(), sorted)).extracting(r -> r.get("Id")).containsExactly("1");

        assertThat(MemoryConditionUtil.apply(rows(), Condition.filter().offset(4).limit(Integer.MAX_VALUE))).isEmpty();
    }
}
