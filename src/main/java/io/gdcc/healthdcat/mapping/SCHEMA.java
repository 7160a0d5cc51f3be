package io.gdcc.healthdcat.mapping;

import org.apache.jena.rdf.model.Model;
import org.apache.jena.rdf.model.ModelFactory;
import org.apache.jena.rdf.model.Property;

/** schema.org terms used by the converter. */
public final class SCHEMA {

    private static final Model m = ModelFactory.createDefaultModel();

    public static final String NS = "http://schema.org/";

    private SCHEMA() {}

    public static final Property numberOfItems = m.createProperty(NS + "numberOfItems");
}
