package io.gdcc.healthdcat.mapping;

import org.apache.jena.rdf.model.Model;
import org.apache.jena.rdf.model.ModelFactory;
import org.apache.jena.rdf.model.Property;
import org.apache.jena.rdf.model.Resource;

/**
 * The subset of the <a href="https://www.w3.org/ns/csvw">CSV on the Web vocabulary</a> used to
 * describe the columns of a converted table.
 */
public final class CSVW {

    private static final Model m = ModelFactory.createDefaultModel();

    public static final String NS = "http://www.w3.org/ns/csvw#";

    private CSVW() {}

    // classes
    public static final Resource TableSchema = m.createResource(NS + "TableSchema");
    public static final Resource Column = m.createResource(NS + "Column");

    // properties
    public static final Property tableSchema = m.createProperty(NS + "tableSchema");
    public static final Property column = m.createProperty(NS + "column");
    public static final Property name = m.createProperty(NS + "name");
    public static final Property title = m.createProperty(NS + "title");
    public static final Property datatype = m.createProperty(NS + "datatype");
}
