package io.gdcc.healthdcat.mapping;

import io.gdcc.healthdcat.config.loader.ProfileConfigLoader;
import io.gdcc.healthdcat.config.model.EntityType;
import io.gdcc.healthdcat.config.model.FieldMapping;
import io.gdcc.healthdcat.config.model.ProfileConfig;
import io.gdcc.healthdcat.error.MissingConfigurationException;
import io.gdcc.healthdcat.error.StageException;
import io.gdcc.healthdcat.error.UnsupportedFormatException;
import io.gdcc.healthdcat.model.RecordSet;
import io.gdcc.healthdcat.plugin.GeneratorPlugin;
import io.gdcc.healthdcat.plugin.StageOptions;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.jena.datatypes.xsd.XSDDatatype;
import org.apache.jena.rdf.model.Model;
import org.apache.jena.riot.RDFDataMgr;
import org.apache.jena.shared.JenaException;
import org.apache.jena.vocabulary.DCAT;
import org.apache.jena.vocabulary.DCTerms;
import org.apache.jena.vocabulary.RDFS;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generates the HealthDCAT-AP graph for a record set and serializes it.
 *
 * <p>Options:
 *
 * <ul>
 *   <li>{@code format}: one of {@link RdfFormat#ids()}, default {@code turtle}
 *   <li>{@code datasetUri}: absolute base IRI for all identifiers (required)
 *   <li>{@code propertyMapping}: column to predicate CURIE/IRI, overriding the profile mapping
 *   <li>{@code naturalKey}: column identifying rows instead of the row index
 *   <li>{@code includeTableSchema}: describe the columns with CSVW, default true
 *   <li>{@code includeUnmapped}: emit unmapped columns as literals, default false
 *   <li>{@code catalogTitle}, {@code catalogDescription}: catalog labels
 * </ul>
 */
public class RdfGeneratorPlugin implements GeneratorPlugin {
    public static final String NAME = "rdf_generator";
    public static final String DEFAULT_FORMAT = "turtle";

    private static final Logger log = LoggerFactory.getLogger(RdfGeneratorPlugin.class);

    private final ProfileConfig profile;

    public RdfGeneratorPlugin() {
        this(null);
    }

    /** @param profile profile to map against; null uses the default profile */
    public RdfGeneratorPlugin(ProfileConfig profile) {
        this.profile = profile;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String execute(RecordSet input, StageOptions options) throws StageException {
        RdfFormat format = resolveFormat(options);
        EntityGraph graph = buildGraph(input, options);
        return serialize(graph, format);
    }

    /** Resolves the {@code format} option; fails before any entity is built. */
    public static RdfFormat resolveFormat(StageOptions options) throws UnsupportedFormatException {
        String id = options.getString("format", DEFAULT_FORMAT);
        return RdfFormat.fromId(id)
                .orElseThrow(() -> new UnsupportedFormatException(NAME, id, RdfFormat.ids()));
    }

    /** Builds the entity graph without serializing it. */
    public EntityGraph buildGraph(RecordSet records, StageOptions options) throws StageException {
        ProfileConfig config = profile();
        IdentifierFactory ids = identifiers(options);
        EntityMapper mapper = mapper(config, options);
        List<String> keys = rowKeys(records, options.getString("naturalKey"));

        EntityGraph graph = new EntityGraph();
        Entity catalog = graph.entity(ids.catalog(), EntityType.CATALOG.typeIri());
        catalog.add(
                DCTerms.title.getURI(),
                Value.literal(options.getString("catalogTitle", "Health Dataset")));
        catalog.add(
                DCTerms.description.getURI(),
                Value.literal(
                        options.getString("catalogDescription", "Dataset converted from CSV")));
        catalog.add(
                SCHEMA.numberOfItems.getURI(),
                Value.typed(
                        Integer.toString(records.size()), XSDDatatype.XSDinteger.getURI()));

        try {
            for (int row = 0; row < records.size(); row++) {
                Entity dataset = mapper.map(graph, ids, records.get(row), keys.get(row));
                catalog.addReference(DCAT.dataset.getURI(), dataset);
            }
        } catch (IllegalStateException e) {
            throw new StageException(NAME, e);
        }

        if (options.getBoolean("includeTableSchema", true) && !records.isEmpty()) {
            addTableSchema(graph, ids, catalog, records);
        }
        log.debug("Built {} entities for {} rows", graph.size(), records.size());
        return graph;
    }

    /** Writes the graph in the given format. Pure: no I/O beyond the in-memory buffer. */
    public String serialize(EntityGraph graph, RdfFormat format) throws StageException {
        Model model = graph.toModel(new Prefixes(profile().prefixes()));
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            RDFDataMgr.write(out, model, format.jenaFormat());
        } catch (JenaException e) {
            throw new StageException(NAME, "Could not serialize graph as " + format.id(), e);
        }
        return out.toString(StandardCharsets.UTF_8);
    }

    private IdentifierFactory identifiers(StageOptions options)
            throws MissingConfigurationException {
        String datasetUri = options.getString("datasetUri");
        if (datasetUri == null || datasetUri.isBlank()) {
            throw new MissingConfigurationException(
                    NAME, "datasetUri", "Option 'datasetUri' is required");
        }
        try {
            return new IdentifierFactory(datasetUri);
        } catch (IllegalArgumentException e) {
            throw new MissingConfigurationException(
                    NAME,
                    "datasetUri",
                    "Option 'datasetUri' must be an absolute IRI: " + datasetUri);
        }
    }

    private EntityMapper mapper(ProfileConfig config, StageOptions options)
            throws MissingConfigurationException {
        Map<String, FieldMapping> fields = new LinkedHashMap<>(config.fields());
        options.getStringMap("propertyMapping")
                .forEach(
                        (column, predicate) ->
                                fields.put(
                                        column,
                                        fields.containsKey(column)
                                                ? fields.get(column).withPredicate(predicate)
                                                : FieldMapping.literal(column, predicate)));
        try {
            return new EntityMapper(
                    fields,
                    new Prefixes(config.prefixes()),
                    config.agentKey(),
                    options.getBoolean("includeUnmapped", false));
        } catch (IllegalArgumentException e) {
            throw new MissingConfigurationException(NAME, "propertyMapping", e.getMessage());
        }
    }

    /** Row index keys, or natural key values which must be present and unique. */
    private static List<String> rowKeys(RecordSet records, String naturalKey)
            throws StageException {
        List<String> keys = new ArrayList<>(records.size());
        if (naturalKey == null || naturalKey.isBlank()) {
            for (int row = 0; row < records.size(); row++) {
                keys.add(Integer.toString(row));
            }
            return keys;
        }
        Map<String, Integer> firstRow = new HashMap<>();
        for (int row = 0; row < records.size(); row++) {
            if (records.get(row).isBlank(naturalKey)) {
                throw new StageException(
                        NAME, "Row " + row + " has no value for natural key '" + naturalKey + "'");
            }
            String key = records.get(row).getString(naturalKey).trim();
            Integer previous = firstRow.putIfAbsent(key, row);
            if (previous != null) {
                throw new StageException(
                        NAME,
                        "Rows "
                                + previous
                                + " and "
                                + row
                                + " share natural key '"
                                + key
                                + "'; deduplicate them before generation");
            }
            keys.add(key);
        }
        return keys;
    }

    private static void addTableSchema(
            EntityGraph graph, IdentifierFactory ids, Entity catalog, RecordSet records) {
        Entity schema = graph.entity(ids.tableSchema(), EntityType.TABLE_SCHEMA.typeIri());
        catalog.addReference(CSVW.tableSchema.getURI(), schema);
        List<String> columns = records.columns();
        for (int i = 0; i < columns.size(); i++) {
            String name = columns.get(i);
            Entity column = graph.entity(ids.column(i), EntityType.COLUMN.typeIri());
            schema.addReference(CSVW.column.getURI(), column);
            column.add(CSVW.name.getURI(), Value.literal(name));
            column.add(CSVW.title.getURI(), Value.literal(name));
            column.add(RDFS.label.getURI(), Value.literal(name));
            column.add(
                    CSVW.datatype.getURI(), Value.literal(ColumnDatatypes.infer(records, name)));
        }
    }

    private ProfileConfig profile() {
        return profile != null ? profile : ProfileConfigLoader.loadDefault();
    }
}
