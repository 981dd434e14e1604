package com.lazyframe.runtime;

import com.lazyframe.test.TestBase;
import com.lazyframe.test.TestCategories;
import java.util.Map;
import java.util.Properties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("EngineConfig Tests")
public class EngineConfigTest extends TestBase {

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        @DisplayName("Default values match the documented settings")
        void testDefaults() {
            EngineConfig config = EngineConfig.defaults();

            assertThat(config.broadcastThresholdBytes()).isEqualTo(10L * 1024 * 1024);
            assertThat(config.maxOptimizerPasses()).isEqualTo(20);
            assertThat(config.batchSize()).isEqualTo(4096);
            assertThat(config.defaultPartitionCount()).isBetween(1, 8);
        }

        @Test
        @DisplayName("Defaults map contains every key")
        void testDefaultsMap() {
            assertThat(EngineConfig.getDefaults()).containsKeys(
                EngineConfig.BROADCAST_THRESHOLD_BYTES,
                EngineConfig.MAX_OPTIMIZER_PASSES,
                EngineConfig.DEFAULT_PARTITION_COUNT,
                EngineConfig.BATCH_SIZE);
        }
    }

    @Nested
    @DisplayName("Overrides")
    class Overrides {

        @Test
        @DisplayName("Map overrides replace defaults and unknown keys are ignored")
        void testFromMap() {
            EngineConfig config = EngineConfig.fromMap(Map.of(
                EngineConfig.BROADCAST_THRESHOLD_BYTES, "1024",
                EngineConfig.DEFAULT_PARTITION_COUNT, " 3 ",
                "spark.sql.shuffle.partitions", "200"));

            assertThat(config.broadcastThresholdBytes()).isEqualTo(1024);
            assertThat(config.defaultPartitionCount()).isEqualTo(3);
            assertThat(config.maxOptimizerPasses()).isEqualTo(20);
        }

        @Test
        @DisplayName("Invalid number names the offending key")
        void testInvalidNumber() {
            assertThatThrownBy(() -> EngineConfig.fromMap(Map.of(EngineConfig.MAX_OPTIMIZER_PASSES, "many")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(EngineConfig.MAX_OPTIMIZER_PASSES);
        }

        @Test
        @DisplayName("Properties with the lazyframe prefix are read")
        void testFromProperties() {
            Properties properties = new Properties();
            properties.setProperty(EngineConfig.BATCH_SIZE, "128");
            properties.setProperty("user.name", "someone");

            EngineConfig config = EngineConfig.fromProperties(properties);

            assertThat(config.batchSize()).isEqualTo(128);
        }

        @Test
        @DisplayName("Out-of-range values are rejected")
        void testValidation() {
            assertThatThrownBy(() -> EngineConfig.builder().maxOptimizerPasses(0))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> EngineConfig.builder().defaultPartitionCount(0))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> EngineConfig.builder().broadcastThresholdBytes(-1))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("asMap round-trips through fromMap")
        void testAsMap() {
            EngineConfig config = EngineConfig.builder().broadcastThresholdBytes(77).defaultPartitionCount(2).build();

            assertThat(EngineConfig.fromMap(config.asMap()).toString()).isEqualTo(config.toString());
        }
    }

    @ParameterizedTest
    @DisplayName("Batch size is clamped to [64, 65536]")
    @CsvSource({
        "1, 64",
        "64, 64",
        "4096, 4096",
        "65536, 65536",
        "1000000, 65536"
    })
    void testBatchSizeNormalization(int requested, int expected) {
        assertThat(EngineConfig.builder().batchSize(requested).build().batchSize()).isEqualTo(expected);
    }
}
