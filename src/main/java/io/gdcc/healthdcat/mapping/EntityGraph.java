package io.gdcc.healthdcat.mapping;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.jena.datatypes.RDFDatatype;
import org.apache.jena.datatypes.TypeMapper;
import org.apache.jena.rdf.model.Literal;
import org.apache.jena.rdf.model.Model;
import org.apache.jena.rdf.model.ModelFactory;
import org.apache.jena.rdf.model.Property;
import org.apache.jena.rdf.model.RDFNode;
import org.apache.jena.rdf.model.Resource;
import org.apache.jena.vocabulary.RDF;

/**
 * Entities of one conversion, in creation order. Creation order is catalog first, then the
 * entities of each row in row order, then the table schema.
 */
public final class EntityGraph {
    private final Map<String, Entity> entities = new LinkedHashMap<>();

    /**
     * Returns the entity with the given identifier, creating it on first use.
     *
     * @throws IllegalStateException if the identifier is already taken by an entity of another
     *     type
     */
    public Entity entity(String identifier, String typeIri) {
        Entity existing = entities.get(identifier);
        if (existing == null) {
            Entity created = new Entity(identifier, typeIri);
            entities.put(identifier, created);
            return created;
        }
        if (!existing.type().equals(typeIri)) {
            throw new IllegalStateException(
                    "Identifier "
                            + identifier
                            + " already assigned to a "
                            + existing.type()
                            + ", cannot reuse it for a "
                            + typeIri);
        }
        return existing;
    }

    public boolean contains(String identifier) {
        return entities.containsKey(identifier);
    }

    public Entity get(String identifier) {
        return entities.get(identifier);
    }

    public Collection<Entity> entities() {
        return Collections.unmodifiableCollection(entities.values());
    }

    public List<Entity> entities(String typeIri) {
        List<Entity> out = new ArrayList<>();
        for (Entity entity : entities.values()) {
            if (entity.type().equals(typeIri)) {
                out.add(entity);
            }
        }
        return out;
    }

    public int size() {
        return entities.size();
    }

    /** Triple view of the graph as a new Jena model; the graph itself is left untouched. */
    public Model toModel(Prefixes prefixes) {
        Model model = ModelFactory.createDefaultModel();
        model.setNsPrefixes(prefixes.jena());
        for (Entity entity : entities.values()) {
            Resource subject = model.createResource(entity.identifier());
            subject.addProperty(RDF.type, model.createResource(entity.type()));
            entity.properties()
                    .forEach(
                            (predicate, values) -> {
                                Property property = model.createProperty(predicate);
                                for (Value value : values) {
                                    subject.addProperty(property, node(model, value));
                                }
                            });
        }
        return model;
    }

    private static RDFNode node(Model model, Value value) {
        if (value.isReference()) {
            return model.createResource(value.reference());
        }
        return literal(model, value);
    }

    private static Literal literal(Model model, Value value) {
        if (value.datatype() != null && !value.datatype().isBlank()) {
            RDFDatatype dt = TypeMapper.getInstance().getSafeTypeByName(value.datatype());
            return model.createTypedLiteral(value.lexical(), dt);
        }
        if (value.lang() != null && !value.lang().isBlank()) {
            return model.createLiteral(value.lexical(), value.lang());
        }
        return model.createLiteral(value.lexical());
    }
}
