package com.lazyframe.types;

import com.lazyframe.test.TestBase;
import com.lazyframe.test.TestCategories;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("StructType Tests")
public class StructTypeTest extends TestBase {

    private final StructType people = schema(
        required("id", LongType.get()),
        field("name", StringType.get()),
        field("born", DateType.get()));

    @Test
    @DisplayName("Fields are looked up by name")
    void testLookup() {
        assertThat(people.fieldIndex("name")).isEqualTo(1);
        assertThat(people.fieldIndex("missing")).isEqualTo(-1);
        assertThat(people.fieldByName("id").nullable()).isFalse();
        assertThat(people.contains("born")).isTrue();
    }

    @Test
    @DisplayName("Duplicate field names are rejected")
    void testDuplicateNames() {
        assertThatThrownBy(() -> schema(field("a", LongType.get()), field("a", StringType.get())))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("a");
    }

    @Test
    @DisplayName("select keeps schema order regardless of argument order")
    void testSelect() {
        StructType narrowed = people.select(List.of("born", "id"));

        assertThat(narrowed.fieldNames()).containsExactly("id", "born");
    }

    @Test
    @DisplayName("Row width is the sum of default sizes")
    void testRowWidth() {
        // long 8 + string 20 + date 4
        assertThat(people.estimatedRowWidth()).isEqualTo(32);
    }
}
