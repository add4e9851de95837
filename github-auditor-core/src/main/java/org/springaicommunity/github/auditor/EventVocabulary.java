package org.springaicommunity.github.auditor;

/**
 * JSON field names used by one audit kind's stream.
 *
 * @param totalField field carrying the unit count in {@code start}
 * @param subjectField field carrying the unit identifier in {@code progress}
 * @param dataField field carrying the unit result in {@code data}
 */
public record EventVocabulary(String totalField, String subjectField, String dataField) {
}
