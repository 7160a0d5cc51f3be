package io.gdcc.healthdcat.config.loader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.gdcc.healthdcat.config.model.EntityType;
import io.gdcc.healthdcat.config.model.FieldMapping;
import io.gdcc.healthdcat.config.model.ProfileConfig;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ProfileConfigLoaderTest {

    @AfterEach
    void clearProperty() {
        System.clearProperty(ProfileConfigLoader.SYS_PROP);
    }

    @Test
    @DisplayName("the bundled profile declares prefixes, fields and validation rules")
    void bundled_profile() {
        ProfileConfig config = ProfileConfigLoader.loadDefault();

        assertThat(config.prefixes())
                .containsEntry("dcat", "http://www.w3.org/ns/dcat#")
                .containsKey("healthdcat");
        assertThat(config.fields().keySet()).startsWith("title", "description", "identifier");
        assertThat(config.fields().get("accessURL").target()).isEqualTo(EntityType.DISTRIBUTION);
        assertThat(config.fields().get("keyword").multi()).isTrue();
        assertThat(config.fields().get("accessRights").map()).containsKey("public");
        assertThat(config.requiredFields()).isEmpty();
        assertThat(config.fieldTypes()).containsEntry("issued", "date");
        assertThat(config.agentKey()).isEqualTo("publisher");
    }

    @Test
    @DisplayName("parse() orders fields by their order key, unordered fields last")
    void field_order() {
        Properties p = new Properties();
        p.setProperty("field.b.predicate", "dct:b");
        p.setProperty("field.b.order", "2");
        p.setProperty("field.a.predicate", "dct:a");
        p.setProperty("field.c.predicate", "dct:c");
        p.setProperty("field.c.order", "1");

        assertThat(ProfileConfigLoader.parse(p).fields().keySet()).containsExactly("c", "b", "a");
    }

    @Test
    @DisplayName("parse() reads every field attribute")
    void field_attributes() {
        Properties p = new Properties();
        p.setProperty("field.theme.predicate", " dcat:theme ");
        p.setProperty("field.theme.target", "distribution");
        p.setProperty("field.theme.as", "iri");
        p.setProperty("field.theme.split", ";");
        p.setProperty("field.theme.format", "http://t/${value}");
        p.setProperty("field.theme.map.a", "http://t/A");
        p.setProperty("validation.required", "title, publisher");
        p.setProperty("agent.key", "owner");

        ProfileConfig config = ProfileConfigLoader.parse(p);
        FieldMapping theme = config.fields().get("theme");

        assertThat(theme.predicate()).isEqualTo("dcat:theme");
        assertThat(theme.target()).isEqualTo(EntityType.DISTRIBUTION);
        assertThat(theme.isIri()).isTrue();
        assertThat(theme.separator()).isEqualTo(";");
        assertThat(theme.format()).isEqualTo("http://t/${value}");
        assertThat(theme.map()).containsEntry("a", "http://t/A");
        assertThat(config.requiredFields()).containsExactly("title", "publisher");
        assertThat(config.agentKey()).isEqualTo("owner");
    }

    @Test
    @DisplayName("a non-numeric order is rejected")
    void bad_order() {
        Properties p = new Properties();
        p.setProperty("field.a.predicate", "dct:a");
        p.setProperty("field.a.order", "first");

        assertThatThrownBy(() -> ProfileConfigLoader.parse(p))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("field.a.order");
    }

    @Test
    @DisplayName("load() prefers the file named by the system property")
    void load_from_system_property(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("profile.properties");
        Files.writeString(file, "prefix.ex=http://example.org/\nfield.x.predicate=ex:x\n");
        System.setProperty(ProfileConfigLoader.SYS_PROP, file.toString());

        ProfileConfig config = ProfileConfigLoader.load();

        assertThat(config.prefixes()).containsOnlyKeys("ex");
        assertThat(config.fields()).containsOnlyKeys("x");
    }

    @Test
    @DisplayName("load(InputStream) parses properties text")
    void load_from_stream() throws Exception {
        byte[] bytes =
                "prefix.dct=http://purl.org/dc/terms/\n".getBytes(StandardCharsets.ISO_8859_1);

        ProfileConfig config = ProfileConfigLoader.load(new ByteArrayInputStream(bytes));

        assertThat(config.prefixes()).containsEntry("dct", "http://purl.org/dc/terms/");
        assertThat(config.fields()).isEmpty();
    }
}
