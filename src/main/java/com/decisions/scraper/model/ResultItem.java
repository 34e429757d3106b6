package com.decisions.scraper.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One court decision read from the portal: the structured columns of a result
 * row plus the full text shown in the detail pane after the row was activated.
 *
 * @param chamber        the chamber (daire) that issued the decision
 * @param caseNumber     the case number (esas no)
 * @param decisionNumber the decision number (karar no)
 * @param decisionDate   the decision date, exactly as the portal formats it
 * @param decisionText   the full decision text
 * @param matchedKeyword the keyword whose search produced this row
 */
public record ResultItem(
        String chamber,
        @JsonProperty("case_number") String caseNumber,
        @JsonProperty("decision_number") String decisionNumber,
        @JsonProperty("decision_date") String decisionDate,
        @JsonProperty("decision_text") String decisionText,
        @JsonProperty("matched_keyword") String matchedKeyword
) {

    /**
     * Composite identity of a decision, {@code caseNumber-decisionNumber}.
     *
     * @return the case identifier used for de-duplication
     */
    public String caseId() {
        return caseId(caseNumber, decisionNumber);
    }

    public static String caseId(final String caseNumber, final String decisionNumber) {
        return caseNumber + "-" + decisionNumber;
    }
}
