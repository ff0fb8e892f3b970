package io.b2mash.orghierarchy.importer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.ExpectedCount.manyTimes;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import io.b2mash.orghierarchy.organization.DataSource;
import io.b2mash.orghierarchy.organization.InMemoryOrganizationStore;
import io.b2mash.orghierarchy.organization.InternalType;
import io.b2mash.orghierarchy.organization.Organization;
import java.net.URI;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.transaction.support.TransactionOperations;
import org.springframework.web.client.RestClient;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

class OrganizationImporterTest {

  private static final URI PAATOS_URL = URI.create("http://fake.url/organizations/?page=1");

  private static final Map<String, Object> ORGANIZATION_1 =
      record(
          "id", 111,
          "data_source", "test-source-1",
          "origin_id", "ABC-123",
          "classification", "test-class-1",
          "name", "Organization-1",
          "founding_date", "2000-01-01",
          "dissolution_date", "2017-01-01",
          "parent", "http://fake.url/organizations/222/",
          "ignored_field", "This field will be ignored");

  private static final Map<String, Object> ORGANIZATION_2 =
      record(
          "id", 222,
          "data_source", "test-source-1",
          "origin_id", "ABC-456",
          "classification", "test-class-1",
          "name", "Organization-2",
          "founding_date", "2000-01-01",
          "dissolution_date", null,
          "parent", null,
          "ignored_field", "This field will be ignored");

  private static final Map<String, Object> ORGANIZATION_3 =
      record(
          "id", 333,
          "data_source", "test-source-2",
          "origin_id", "XYZ-3",
          "classification", "test-class-2",
          "name", "Organization-3",
          "founding_date", "2016-01-01",
          "dissolution_date", null,
          "parent", "http://fake.url/organizations/111/",
          "ignored_field", "This field will be ignored");

  private final ObjectMapper objectMapper = JsonMapper.builder().build();
  private final ImportConfigurationResolver configurationResolver =
      new ImportConfigurationResolver(new PathMatchingResourcePatternResolver(), objectMapper);

  private MockRestServiceServer server;
  private SourceClient sourceClient;
  private InMemoryOrganizationStore store;

  @BeforeEach
  void setUp() {
    var builder = RestClient.builder();
    server = MockRestServiceServer.bindTo(builder).ignoreExpectOrder(true).build();
    sourceClient = new SourceClient(builder.build(), objectMapper);
    store = new InMemoryOrganizationStore();
    respond("http://fake.url/organizations/111/", ORGANIZATION_1);
    respond("http://fake.url/organizations/222/", ORGANIZATION_2);
    respond("http://fake.url/organizations/333/", ORGANIZATION_3);
  }

  @Test
  void importAll_paatos_importsEveryPageWithParents() {
    respond(
        "http://fake.url/organizations/?page=1",
        record(
            "next",
            "http://fake.url/organizations/?page=2",
            "results",
            List.of(ORGANIZATION_1, ORGANIZATION_2)));
    respond(
        "http://fake.url/organizations/?page=2",
        record("next", null, "results", List.of(ORGANIZATION_3)));

    var statistics = importer(paatos()).importAll();

    assertThat(statistics).isEqualTo(new ImportStatistics(3, 0, 0));
    assertThat(store.organizations()).hasSize(3);
    assertThat(store.dataSources())
        .extracting(DataSource::getId)
        .containsExactlyInAnyOrder("test-source-1", "OpenDecisionAPI", "test-source-2");
    assertThat(store.classifications()).hasSize(2);
    assertThat(parentId("test-source-1:abc-123")).isEqualTo("test-source-1:abc-456");
    assertThat(parentId("test-source-2:xyz-3")).isEqualTo("test-source-1:abc-123");
    assertThat(parentId("test-source-1:abc-456")).isNull();
  }

  @Test
  void importOne_linkedParent_isImportedFirst() {
    var organization = importer(paatos()).importOne(ORGANIZATION_1).orElseThrow();

    assertThat(organization.getName()).isEqualTo("Organization-1");
    assertThat(organization.getId()).isEqualTo("test-source-1:abc-123");
    assertThat(organization.getOriginId()).isEqualTo("abc-123");
    assertThat(organization.getFoundingDate()).isEqualTo(LocalDate.of(2000, 1, 1));
    assertThat(organization.getDissolutionDate()).isEqualTo(LocalDate.of(2017, 1, 1));
    assertThat(organization.getClassification().getId()).isEqualTo("OpenDecisionAPI:test-class-1");
    assertThat(organization.getParent().getName()).isEqualTo("Organization-2");
    assertThat(store.organizations()).hasSize(2);
  }

  @Test
  void importOne_bareString_throwsInvalidRecord() {
    assertThatThrownBy(() -> importer(paatos()).importOne("test-value"))
        .isInstanceOf(InvalidRecordException.class);
  }

  @Test
  void importOne_secondRun_updatesExistingOrganization() {
    importer(paatos()).importOne(ORGANIZATION_2);
    var renamed = new LinkedHashMap<>(ORGANIZATION_2);
    renamed.put("name", "Organization-2 renamed");

    var secondRun = importer(paatos());
    var organization = secondRun.importOne(renamed).orElseThrow();

    assertThat(store.organizations()).hasSize(1);
    assertThat(organization.getName()).isEqualTo("Organization-2 renamed");
    assertThat(secondRun.statistics()).isEqualTo(new ImportStatistics(0, 1, 0));
  }

  @Test
  void importOne_originIdInDifferentCase_matchesExistingOrganization() {
    var override =
        ImportConfigurationOverride.builder()
            .fieldConfig(Map.of("origin_id", FieldConfig.DEFAULT))
            .build();
    var configuration = configurationResolver.resolve("paatos", override, null);
    importer(configuration).importOne(ORGANIZATION_2);
    var lowercase = new LinkedHashMap<>(ORGANIZATION_2);
    lowercase.put("origin_id", "abc-456");

    importer(configuration).importOne(lowercase);

    assertThat(store.organizations()).singleElement().satisfies(
        organization -> assertThat(organization.getOriginId()).isEqualTo("ABC-456"));
  }

  @Test
  void importOne_sameOrganizationTwiceInOneRun_firstImportWins() {
    var importer = importer(paatos());
    var first = importer.importOne(ORGANIZATION_2).orElseThrow();
    var renamed = new LinkedHashMap<>(ORGANIZATION_2);
    renamed.put("name", "Organization-2 renamed");

    var second = importer.importOne(renamed).orElseThrow();

    assertThat(second).isSameAs(first);
    assertThat(second.getName()).isEqualTo("Organization-2");
    assertThat(importer.statistics()).isEqualTo(new ImportStatistics(1, 0, 0));
  }

  @Test
  void importOne_skippedClassification_storesNothingAndCachesSkip() {
    var importer = importer(skipping("test-class-1"));

    assertThat(importer.importOne(ORGANIZATION_2)).isEmpty();
    assertThat(importer.importOne(ORGANIZATION_2)).isEmpty();

    assertThat(store.organizations()).isEmpty();
    assertThat(store.classificationLookups()).isEqualTo(1);
    assertThat(importer.statistics()).isEqualTo(new ImportStatistics(0, 0, 1));
  }

  @Test
  void importOne_parentWithSkippedClassification_importsChildWithoutParent() {
    var organization = importer(skipping("test-class-1")).importOne(ORGANIZATION_3).orElseThrow();

    assertThat(organization.getParent()).isNull();
    assertThat(store.organizations())
        .extracting(Organization::getId)
        .containsExactly("test-source-2:xyz-3");
  }

  @Test
  void importAll_renamedDataSources_shareOneStoredDataSource() {
    respond(
        "http://fake.url/organizations/?page=1",
        record("next", null, "results", List.of(ORGANIZATION_1, ORGANIZATION_2, ORGANIZATION_3)));
    var configuration =
        configurationResolver.resolve(
            "paatos", null, List.of("test-source-1:renamed", "test-source-2:renamed"));

    importer(configuration).importAll();

    assertThat(store.dataSources())
        .extracting(DataSource::getId)
        .containsExactlyInAnyOrder("renamed", "OpenDecisionAPI");
    assertThat(store.dataSourceLookups()).isEqualTo(2);
    assertThat(store.organizations())
        .extracting(Organization::getId)
        .containsExactlyInAnyOrder("renamed:abc-123", "renamed:abc-456", "renamed:xyz-3");
  }

  @Test
  void importOne_missingDataSource_usesDefaultDataSource() {
    var record = new LinkedHashMap<>(ORGANIZATION_2);
    record.remove("data_source");

    var organization = importer(paatos()).importOne(record).orElseThrow();

    assertThat(organization.getId()).isEqualTo("OpenDecisionAPI:abc-456");
  }

  @Test
  void importOne_missingRequiredField_throwsFieldMissingAndStoresNothing() {
    var record = new LinkedHashMap<>(ORGANIZATION_2);
    record.remove("name");

    assertThatThrownBy(() -> importer(paatos()).importOne(record))
        .isInstanceOf(FieldMissingException.class)
        .hasMessageContaining("name");
    assertThat(store.organizations()).isEmpty();
  }

  @Test
  void importOne_unparseableDate_throwsFieldValue() {
    var record = new LinkedHashMap<>(ORGANIZATION_2);
    record.put("founding_date", "not-a-date");

    assertThatThrownBy(() -> importer(paatos()).importOne(record))
        .isInstanceOf(FieldValueException.class)
        .hasMessageContaining("founding_date");
  }

  @Test
  void importOne_parentsReferencingEachOther_throwsCircularReference() {
    respond(
        "http://fake.url/organizations/901/",
        record(
            "data_source", "loop",
            "origin_id", "a",
            "classification", "c",
            "name", "A",
            "founding_date", null,
            "dissolution_date", null,
            "parent", "http://fake.url/organizations/902/"));
    respond(
        "http://fake.url/organizations/902/",
        record(
            "data_source", "loop",
            "origin_id", "b",
            "classification", "c",
            "name", "B",
            "founding_date", null,
            "dissolution_date", null,
            "parent", "http://fake.url/organizations/901/"));
    var importer = importer(paatos());

    assertThatThrownBy(
            () ->
                importer.importOne(
                    record(
                        "data_source", "loop",
                        "origin_id", "a",
                        "classification", "c",
                        "name", "A",
                        "founding_date", null,
                        "dissolution_date", null,
                        "parent", "http://fake.url/organizations/902/")))
        .isInstanceOf(CircularReferenceException.class)
        .hasMessageContaining("loop:a");
    assertThat(store.organizations()).isEmpty();
    assertThat(importer.statistics()).isEqualTo(new ImportStatistics(0, 0, 0));
  }

  @Test
  void importAll_tprek_anchorsParentlessUnitsUnderDefaultParent() {
    respond(
        "http://fake.url/units/",
        List.of(
            record("id", 1, "organization_type", "unit", "name_fi", "Unit 1", "parent_id", null),
            record("id", 2, "organization_type", "unit", "name_fi", "Unit 2", "parent_id", 1),
            record("id", 3, "name_fi", "Unit 3")));

    var statistics =
        new OrganizationImporter(
                URI.create("http://fake.url/units/"),
                configurationResolver.resolve("tprek", null, null),
                sourceClient,
                store,
                TransactionOperations.withoutTransaction())
            .importAll();

    var defaultParent = store.findById("tprek:tprek").orElseThrow();
    assertThat(defaultParent.getName()).isEqualTo("Pääkaupunkiseudun toimipisterekisteri");
    assertThat(defaultParent.getParent()).isNull();
    assertThat(parentId("tprek:1")).isEqualTo("tprek:tprek");
    assertThat(parentId("tprek:2")).isEqualTo("tprek:1");
    assertThat(parentId("tprek:3")).isEqualTo("tprek:tprek");
    assertThat(store.findById("tprek:3").orElseThrow().getClassification()).isNull();
    assertThat(statistics).isEqualTo(new ImportStatistics(4, 0, 0));
  }

  @Test
  void importAll_tprekChildBeforeParent_parentKeepsBareIdDataForTheRun() {
    respond(
        "http://fake.url/units/",
        List.of(
            record("id", 2, "organization_type", "unit", "name_fi", "Unit 2", "parent_id", 1),
            record("id", 1, "organization_type", "unit", "name_fi", "Unit 1", "parent_id", null)));
    var configuration = configurationResolver.resolve("tprek", null, null);

    tprekImporter(configuration).importAll();

    var forwardReferenced = store.findById("tprek:1").orElseThrow();
    assertThat(forwardReferenced.getName()).isEmpty();
    assertThat(forwardReferenced.getClassification()).isNull();
    assertThat(forwardReferenced.getParentId()).isEqualTo("tprek:tprek");
    assertThat(parentId("tprek:2")).isEqualTo("tprek:1");

    tprekImporter(configuration)
        .importOne(
            record("id", 1, "organization_type", "unit", "name_fi", "Unit 1", "parent_id", null));

    var updated = store.findById("tprek:1").orElseThrow();
    assertThat(updated.getName()).isEqualTo("Unit 1");
    assertThat(updated.getClassification().getId()).isEqualTo("tprek:unit");
    assertThat(parentId("tprek:2")).isEqualTo("tprek:1");
  }

  @Test
  void importOne_internalTypeChanges_reordersSiblings() {
    var override =
        ImportConfigurationOverride.builder()
            .fields(List.of("data_source", "origin_id", "name", "parent", "internal_type"))
            .updateFields(List.of("name", "parent", "internal_type"))
            .build();
    var configuration = configurationResolver.resolve("paatos", override, null);
    respond(
        "http://fake.url/organizations/900/",
        record(
            "data_source", "city",
            "origin_id", "p",
            "name", "Parent",
            "parent", null,
            "internal_type", "normal"));
    var normal =
        record(
            "data_source", "city",
            "origin_id", "n",
            "name", "Normal",
            "parent", "http://fake.url/organizations/900/",
            "internal_type", "normal");
    var affiliated =
        record(
            "data_source", "city",
            "origin_id", "f",
            "name", "Affiliated",
            "parent", "http://fake.url/organizations/900/",
            "internal_type", "affiliated");

    var firstRun = importer(configuration);
    firstRun.importOne(normal);
    firstRun.importOne(affiliated);
    var parent = store.findById("city:p").orElseThrow();
    assertThat(store.getChildren(parent))
        .extracting(Organization::getId)
        .containsExactly("city:f", "city:n");

    affiliated.put("internal_type", "normal");
    importer(configuration).importOne(affiliated);

    assertThat(store.getChildren(parent))
        .extracting(Organization::getId)
        .containsExactly("city:n", "city:f");
    assertThat(store.findById("city:f").orElseThrow().getInternalType())
        .isEqualTo(InternalType.NORMAL);
  }

  @Test
  void parseDate_acceptsDateAndDateTime() {
    assertThat(OrganizationImporter.parseDate("founding_date", "2017-06-01"))
        .isEqualTo(LocalDate.of(2017, 6, 1));
    assertThat(OrganizationImporter.parseDate("founding_date", "2014-11-27T20:06:22.404134"))
        .isEqualTo(LocalDate.of(2014, 11, 27));
    assertThat(OrganizationImporter.parseDate("founding_date", null)).isNull();
    assertThat(OrganizationImporter.parseDate("founding_date", "")).isNull();
  }

  private OrganizationImporter importer(ImportConfiguration configuration) {
    return new OrganizationImporter(
        PAATOS_URL, configuration, sourceClient, store, TransactionOperations.withoutTransaction());
  }

  private OrganizationImporter tprekImporter(ImportConfiguration configuration) {
    return new OrganizationImporter(
        URI.create("http://fake.url/units/"),
        configuration,
        sourceClient,
        store,
        TransactionOperations.withoutTransaction());
  }

  private ImportConfiguration paatos() {
    return configurationResolver.resolve("paatos", null, null);
  }

  private ImportConfiguration skipping(String classification) {
    var override =
        ImportConfigurationOverride.builder()
            .skipClassifications(List.of(classification))
            .build();
    return configurationResolver.resolve("paatos", override, null);
  }

  private String parentId(String organizationId) {
    return store.findById(organizationId).orElseThrow().getParentId();
  }

  private void respond(String url, Object body) {
    server
        .expect(manyTimes(), requestTo(url))
        .andRespond(
            withSuccess(objectMapper.writeValueAsString(body), MediaType.APPLICATION_JSON));
  }

  static Map<String, Object> record(Object... keysAndValues) {
    var record = new LinkedHashMap<String, Object>();
    for (int i = 0; i < keysAndValues.length; i += 2) {
      record.put((String) keysAndValues[i], keysAndValues[i + 1]);
    }
    return record;
  }
}
