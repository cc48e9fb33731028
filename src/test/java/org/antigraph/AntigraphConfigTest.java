package org.antigraph;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class AntigraphConfigTest {

  @Test
  void testDefaults() throws Exception {
    AntigraphConfig config = new AntigraphConfig();
    config.validate();

    assertThat(config.cutoff).isEqualTo(128);
    assertThat(config.cutoffSquared()).isEqualTo(128 * 128);
    assertThat(config.brighten).isEqualTo(0.1);
    assertThat(config.unshift).isZero();
    assertThat(config.unalias).isZero();
    assertThat(config.threads).isEqualTo(1);
    assertThat(config.aliasMode).isEqualTo(AliasMode.CORROBORATE);
  }

  @Test
  void testCutoffSquaredDoesNotWrap() {
    AntigraphConfig config = new AntigraphConfig();
    config.cutoff = 46341;
    assertThat(config.cutoffSquared()).isEqualTo(2147488281L);
    config.cutoff = 65536;
    assertThat(config.cutoffSquared()).isEqualTo(1L << 32);
    config.cutoff = Integer.MAX_VALUE;
    assertThat(config.cutoffSquared()).isPositive();
  }

  @Test
  void testValidationFailures() {
    AntigraphConfig negativeShift = new AntigraphConfig();
    negativeShift.unshift = -1;
    assertThatThrownBy(negativeShift::validate)
        .isInstanceOf(ConfigurationException.class).hasMessageContaining("unshift");

    AntigraphConfig negativeAlias = new AntigraphConfig();
    negativeAlias.unalias = -2;
    assertThatThrownBy(negativeAlias::validate)
        .isInstanceOf(ConfigurationException.class).hasMessageContaining("unalias");

    AntigraphConfig tooBright = new AntigraphConfig();
    tooBright.brighten = 101;
    assertThatThrownBy(tooBright::validate)
        .isInstanceOf(ConfigurationException.class).hasMessageContaining("brighten");

    AntigraphConfig noThreads = new AntigraphConfig();
    noThreads.threads = 0;
    assertThatThrownBy(noThreads::validate)
        .isInstanceOf(ConfigurationException.class).hasMessageContaining("threads");

    AntigraphConfig negativeCutoff = new AntigraphConfig();
    negativeCutoff.cutoff = -5;
    assertThatThrownBy(negativeCutoff::validate)
        .isInstanceOf(ConfigurationException.class).hasMessageContaining("cutoff");
  }

  @Test
  void testFromProperties() throws Exception {
    Map<String, String> props = new HashMap<String, String>();
    props.put("spark.antigraph.cutoff", "64");
    props.put("spark.antigraph.brighten", " 2.5 ");
    props.put("spark.antigraph.unshift", "2");
    props.put("spark.antigraph.unalias", "1");
    props.put("spark.antigraph.threads", "8");
    props.put("spark.antigraph.aliasMode", "strict");
    props.put("cutoff", "1");

    AntigraphConfig config = AntigraphConfig.fromProperties(props, "spark.antigraph.");

    assertThat(config.cutoff).isEqualTo(64);
    assertThat(config.brighten).isEqualTo(2.5);
    assertThat(config.unshift).isEqualTo(2);
    assertThat(config.unalias).isEqualTo(1);
    assertThat(config.threads).isEqualTo(8);
    assertThat(config.aliasMode).isEqualTo(AliasMode.STRICT);
  }

  @Test
  void testFromPropertiesKeepsDefaults() throws Exception {
    AntigraphConfig config =
        AntigraphConfig.fromProperties(new HashMap<String, String>(), "antigraph.");

    assertThat(config.cutoff).isEqualTo(AntigraphConfig.DEFAULT_CUTOFF);
    assertThat(config.brighten).isEqualTo(AntigraphConfig.DEFAULT_BRIGHTEN);
  }

  @Test
  void testFromPropertiesRejectsBadValues() {
    Map<String, String> notANumber = new HashMap<String, String>();
    notANumber.put("cutoff", "lots");
    assertThatThrownBy(() -> AntigraphConfig.fromProperties(notANumber, ""))
        .isInstanceOf(ConfigurationException.class).hasMessageContaining("cutoff");

    Map<String, String> badMode = new HashMap<String, String>();
    badMode.put("aliasMode", "sometimes");
    assertThatThrownBy(() -> AntigraphConfig.fromProperties(badMode, ""))
        .isInstanceOf(ConfigurationException.class).hasMessageContaining("aliasMode");

    Map<String, String> outOfRange = new HashMap<String, String>();
    outOfRange.put("unalias", "-1");
    assertThatThrownBy(() -> AntigraphConfig.fromProperties(outOfRange, ""))
        .isInstanceOf(ConfigurationException.class);
  }
}
