package io.b2mash.orghierarchy.importer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import tools.jackson.databind.json.JsonMapper;

class ImportConfigurationResolverTest {

  private final JsonMapper objectMapper = JsonMapper.builder().build();
  private ImportConfigurationResolver resolver;

  @BeforeEach
  void setUp() {
    resolver =
        new ImportConfigurationResolver(new PathMatchingResourcePatternResolver(), objectMapper);
  }

  @Test
  void presets_loadsBundledConfigurations() {
    assertThat(resolver.presetNames()).contains("paatos", "tprek", "openahjo");
  }

  @Test
  void preset_paatos_matchesOpenDecisionApi() {
    var paatos = resolver.preset("paatos");

    assertThat(paatos.nextKey()).isEqualTo("next");
    assertThat(paatos.resultsKey()).isEqualTo("results");
    assertThat(paatos.hasMeta()).isFalse();
    assertThat(paatos.defaultDataSource()).isEqualTo("OpenDecisionAPI");
    assertThat(paatos.fieldConfigFor("parent").dataType()).isEqualTo("link");
    assertThat(paatos.fieldConfigFor("origin_id").dataType()).isEqualTo("str_lower");
    assertThat(paatos.fieldConfigFor("name")).isEqualTo(FieldConfig.DEFAULT);
    assertThat(paatos.hasDefaultParent()).isFalse();
  }

  @Test
  void preset_openahjo_usesMetaPagination() {
    var openahjo = resolver.preset("openahjo");

    assertThat(openahjo.hasMeta()).isTrue();
    assertThat(openahjo.metaKey()).isEqualTo("meta");
    assertThat(openahjo.nextKey()).isEqualTo("next");
    assertThat(openahjo.resultsKey()).isEqualTo("objects");
    assertThat(openahjo.defaultDataSource()).isEqualTo("OpenAhjoAPI");
    assertThat(openahjo.fieldConfigFor("parent"))
        .isEqualTo(
            new FieldConfig(
                "parents", "org_id_regex", true, true, true, "\\/(\\w+:\\w+)\\/$"));
  }

  @Test
  void preset_tprek_hasDefaultParentAndNoPagination() {
    var tprek = resolver.preset("tprek");

    assertThat(tprek.nextKey()).isNull();
    assertThat(tprek.resultsKey()).isNull();
    assertThat(tprek.defaultParentOrganization())
        .isEqualTo("Pääkaupunkiseudun toimipisterekisteri");
    assertThat(tprek.fieldConfigFor("origin_id").sourceField()).isEqualTo("id");
  }

  @Test
  void preset_unknownName_throwsConfigurationException() {
    assertThatThrownBy(() -> resolver.preset("missing"))
        .isInstanceOf(ImportConfigurationException.class)
        .hasMessageContaining("missing");
  }

  @Test
  void merge_keepsOnlyFieldConfigOfListedFields() {
    var override =
        ImportConfigurationOverride.builder()
            .nextKey("next_page")
            .resultsKey("items")
            .fields(List.of("classification", "name", "parent"))
            .fieldConfig(Map.of("classification", FieldConfig.ofType("link")))
            .build();

    var merged = ImportConfigurationResolver.merge(resolver.preset("paatos"), override);

    assertThat(merged.nextKey()).isEqualTo("next_page");
    assertThat(merged.resultsKey()).isEqualTo("items");
    assertThat(merged.fields()).containsExactly("classification", "name", "parent");
    assertThat(merged.fieldConfig())
        .containsOnlyKeys("classification", "parent")
        .containsEntry("classification", FieldConfig.ofType("link"))
        .containsEntry("parent", FieldConfig.ofType("link"));
    assertThat(merged.defaultDataSource()).isEqualTo("OpenDecisionAPI");
  }

  @Test
  void merge_withoutOverride_returnsBase() {
    var paatos = resolver.preset("paatos");

    assertThat(ImportConfigurationResolver.merge(paatos, null)).isSameAs(paatos);
  }

  @Test
  void resolve_renames_replaceRenameMap() {
    var configuration = resolver.resolve("openahjo", null, List.of("OpenAhjoAPI:remapped"));

    assertThat(configuration.renameDataSource()).containsOnly(Map.entry("OpenAhjoAPI", "remapped"));
    assertThat(configuration.renamedDataSource("OpenAhjoAPI")).isEqualTo("remapped");
    assertThat(configuration.renamedDataSource("other")).isEqualTo("other");
  }

  @Test
  void resolve_unknownField_throwsConfigurationException() {
    var override =
        ImportConfigurationOverride.builder()
            .fields(List.of("origin_id", "color"))
            .updateFields(List.of())
            .build();

    assertThatThrownBy(() -> resolver.resolve("paatos", override, null))
        .isInstanceOf(ImportConfigurationException.class)
        .hasMessageContaining("color");
  }

  @Test
  void resolve_updateFieldNotInFields_throwsConfigurationException() {
    var override =
        ImportConfigurationOverride.builder()
            .fields(List.of("origin_id", "name"))
            .updateFields(List.of("name", "parent"))
            .build();

    assertThatThrownBy(() -> resolver.resolve("paatos", override, null))
        .isInstanceOf(ImportConfigurationException.class)
        .hasMessageContaining("parent");
  }

  @Test
  void resolve_regexWithoutPattern_throwsConfigurationException() {
    var override =
        ImportConfigurationOverride.builder()
            .fieldConfig(Map.of("origin_id", FieldConfig.ofType("regex")))
            .build();

    assertThatThrownBy(() -> resolver.resolve("paatos", override, null))
        .isInstanceOf(ImportConfigurationException.class)
        .hasMessageContaining("pattern");
  }

  @Test
  void resolve_unknownDataType_listsSupportedTypes() {
    var override =
        ImportConfigurationOverride.builder()
            .fieldConfig(Map.of("name", FieldConfig.ofType("not-exist-data-type")))
            .build();

    assertThatThrownBy(() -> resolver.resolve("paatos", override, null))
        .isInstanceOf(ImportConfigurationException.class)
        .hasMessageContaining("not-exist-data-type")
        .hasMessageContaining("org_id_regex");
  }

  @Test
  void resolve_blankDefaultDataSource_throwsConfigurationException() {
    var override = ImportConfigurationOverride.builder().defaultDataSource(" ").build();

    assertThatThrownBy(() -> resolver.resolve("paatos", override, null))
        .isInstanceOf(ImportConfigurationException.class)
        .hasMessageContaining("default_data_source");
  }

  @Test
  void readValue_flagsLeftOut_defaultToFalse() {
    var fieldConfig = objectMapper.readValue("""
        {"source_field": "name_fi"}
        """, FieldConfig.class);
    var configuration = objectMapper.readValue("""
        {"fields": ["origin_id"], "default_data_source": "source"}
        """, ImportConfiguration.class);

    assertThat(fieldConfig.optional()).isFalse();
    assertThat(fieldConfig.unwrapList()).isFalse();
    assertThat(fieldConfig.unquote()).isFalse();
    assertThat(fieldConfig).isEqualTo(new FieldConfig("name_fi", null, false, false, false, null));
    assertThat(configuration.hasMeta()).isFalse();
    assertThat(configuration.metaKey()).isEqualTo("meta");
  }

  @Test
  void merge_overrideGivingNulls_clearsPresetValues() {
    var override =
        ImportConfigurationOverride.builder().nextKey(null).resultsKey(null).build();

    var merged = ImportConfigurationResolver.merge(resolver.preset("paatos"), override);

    assertThat(merged.nextKey()).isNull();
    assertThat(merged.resultsKey()).isNull();
    assertThat(merged.fields()).isEqualTo(resolver.preset("paatos").fields());
  }

  @Test
  void resolve_jsonOverrideWithNullDefaultParent_removesDefaultParent() {
    var override = objectMapper.readValue("""
        {"default_parent_organization": null}
        """, ImportConfigurationOverride.class);

    var configuration = resolver.resolve("tprek", override, null);

    assertThat(override.isGiven("default_parent_organization")).isTrue();
    assertThat(configuration.hasDefaultParent()).isFalse();
    assertThat(configuration.defaultDataSource()).isEqualTo("tprek");
  }

  @Test
  void resolve_jsonOverrideSwitchingOffPagination_keepsOtherPresetValues() {
    var override = objectMapper.readValue("""
        {"next_key": null, "results_key": null, "has_meta": null}
        """, ImportConfigurationOverride.class);

    var configuration = resolver.resolve("openahjo", override, null);

    assertThat(configuration.nextKey()).isNull();
    assertThat(configuration.resultsKey()).isNull();
    assertThat(configuration.hasMeta()).isFalse();
    assertThat(configuration.defaultDataSource()).isEqualTo("OpenAhjoAPI");
    assertThat(configuration.fieldConfigFor("parent").dataType()).isEqualTo("org_id_regex");
  }

  @Test
  void resolve_emptyJsonOverride_keepsPreset() {
    var override = objectMapper.readValue("{}", ImportConfigurationOverride.class);

    var configuration = resolver.resolve("paatos", override, null);

    assertThat(override.givenKeys()).isEmpty();
    assertThat(configuration).isEqualTo(resolver.preset("paatos"));
  }
}
