package io.gdcc.healthdcat.config.model;

import java.util.List;
import java.util.Map;

/**
 * Application profile configuration: namespace prefixes, the default column mapping and default
 * validation rules.
 *
 * @param prefixes prefix to namespace IRI, in declaration order
 * @param fields column name to mapping, in declaration order
 * @param requiredFields columns every row must fill
 * @param fieldTypes column name to type rule (integer, decimal, boolean, date, uri)
 * @param agentKey column whose value identifies the publishing agent
 */
public record ProfileConfig(
        Map<String, String> prefixes,
        Map<String, FieldMapping> fields,
        List<String> requiredFields,
        Map<String, String> fieldTypes,
        String agentKey) {}
