package io.gdcc.healthdcat.validation;

import io.gdcc.healthdcat.config.loader.ProfileConfigLoader;
import io.gdcc.healthdcat.config.model.ProfileConfig;
import io.gdcc.healthdcat.error.StageException;
import io.gdcc.healthdcat.error.ValidationFailedException;
import io.gdcc.healthdcat.model.Record;
import io.gdcc.healthdcat.model.RecordSet;
import io.gdcc.healthdcat.model.ValidationIssue;
import io.gdcc.healthdcat.model.ValidationReport;
import io.gdcc.healthdcat.plugin.StageOptions;
import io.gdcc.healthdcat.plugin.ValidatorPlugin;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks required fields and value formats row by row.
 *
 * <p>Options:
 *
 * <ul>
 *   <li>{@code strict} (default false): any issue fails the stage with {@link
 *       ValidationFailedException}
 *   <li>{@code allowEmpty} (default false): a present but blank value satisfies {@code required}
 *   <li>{@code dropInvalidRows} (default false): in lenient mode, leave rows with issues out of
 *       the valid records instead of passing every row on
 *   <li>{@code requiredFields}, {@code fieldTypes}, {@code useProfileRules}: see {@link
 *       RuleSet#from(ProfileConfig, StageOptions)}
 * </ul>
 */
public class RuleValidator implements ValidatorPlugin {
    public static final String NAME = "validator";

    private static final Logger log = LoggerFactory.getLogger(RuleValidator.class);

    private final ProfileConfig profile;

    public RuleValidator() {
        this(null);
    }

    /** @param profile default rules; null loads the default profile lazily */
    public RuleValidator(ProfileConfig profile) {
        this.profile = profile;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public ValidationReport execute(RecordSet input, StageOptions options) throws StageException {
        RuleSet ruleSet = RuleSet.from(profile(options), options);
        boolean allowEmpty = options.getBoolean("allowEmpty", false);
        List<List<ValidationIssue>> perRow = validateRows(input, ruleSet, allowEmpty);

        List<ValidationIssue> issues = new ArrayList<>();
        perRow.forEach(issues::addAll);

        if (input.isEmpty()) {
            log.warn("Dataset is empty");
        }
        if (!issues.isEmpty() && options.getBoolean("strict", false)) {
            throw new ValidationFailedException(NAME, issues);
        }

        RecordSet valid = input;
        if (!issues.isEmpty() && options.getBoolean("dropInvalidRows", false)) {
            List<Record> kept = new ArrayList<>();
            for (int row = 0; row < input.size(); row++) {
                if (perRow.get(row).isEmpty()) {
                    kept.add(input.get(row));
                }
            }
            valid = RecordSet.of(kept);
        }
        if (!issues.isEmpty()) {
            log.warn("Validation found {} issues in {} rows", issues.size(), input.size());
        }
        return new ValidationReport(valid, issues);
    }

    /** Issues for every row, in row order then rule declaration order. */
    public static List<ValidationIssue> validate(
            RecordSet records, RuleSet ruleSet, boolean allowEmpty) {
        List<ValidationIssue> issues = new ArrayList<>();
        validateRows(records, ruleSet, allowEmpty).forEach(issues::addAll);
        return issues;
    }

    private static List<List<ValidationIssue>> validateRows(
            RecordSet records, RuleSet ruleSet, boolean allowEmpty) {
        List<List<ValidationIssue>> perRow = new ArrayList<>(records.size());
        for (int row = 0; row < records.size(); row++) {
            Record record = records.get(row);
            List<ValidationIssue> rowIssues = new ArrayList<>();
            for (FieldRule rule : ruleSet.rules()) {
                ValidationIssue issue = check(row, record, rule, allowEmpty);
                if (issue != null) {
                    rowIssues.add(issue);
                }
            }
            perRow.add(rowIssues);
        }
        return perRow;
    }

    /** At most one issue per (row, field): a missing value is not also reported as malformed. */
    private static ValidationIssue check(
            int row, Record record, FieldRule rule, boolean allowEmpty) {
        String field = rule.field();
        boolean present = record.has(field) && record.get(field) != null;
        if (!present || record.isBlank(field)) {
            boolean satisfied = present && allowEmpty;
            return (rule.required() && !satisfied) ? ValidationIssue.required(row, field) : null;
        }
        Object value = record.get(field);
        if (!rule.type().accepts(value)) {
            return ValidationIssue.malformed(row, field, rule.type().ruleId(), value);
        }
        if (rule.pattern() != null && !rule.pattern().matcher(value.toString()).matches()) {
            return ValidationIssue.malformed(row, field, "pattern", value);
        }
        return null;
    }

    private ProfileConfig profile(StageOptions options) {
        if (profile != null || !options.getBoolean("useProfileRules", true)) {
            return profile;
        }
        return ProfileConfigLoader.loadDefault();
    }
}
