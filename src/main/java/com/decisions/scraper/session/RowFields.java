package com.decisions.scraper.session;

import com.decisions.scraper.driver.PageElement;
import com.decisions.scraper.model.ResultItem;
import org.apache.commons.lang3.StringUtils;

import java.util.List;

/**
 * Structured columns of one result row.
 * <p>
 * The portal renders a leading index column followed by chamber, case number,
 * decision number and decision date.
 * </p>
 *
 * @param chamber        issuing chamber
 * @param caseNumber     case number
 * @param decisionNumber decision number
 * @param decisionDate   decision date as rendered
 */
record RowFields(String chamber, String caseNumber, String decisionNumber, String decisionDate) {

    static final int MIN_CELLS = 5;

    private static final int CHAMBER_CELL = 1;
    private static final int CASE_NUMBER_CELL = 2;
    private static final int DECISION_NUMBER_CELL = 3;
    private static final int DECISION_DATE_CELL = 4;

    /**
     * Reads the row's cells.
     *
     * @param row          the result row
     * @param cellSelector selector of the cells inside the row
     * @return the extracted fields
     * @throws RowExtractionException when the row has too few cells or lacks
     *                                a chamber or case number
     */
    static RowFields from(final PageElement row, final String cellSelector) {
        List<PageElement> cells = row.findAll(cellSelector);
        if (cells.size() < MIN_CELLS) {
            throw new RowExtractionException("expected " + MIN_CELLS + " cells, found " + cells.size());
        }
        RowFields fields = new RowFields(
                StringUtils.normalizeSpace(cells.get(CHAMBER_CELL).text()),
                StringUtils.normalizeSpace(cells.get(CASE_NUMBER_CELL).text()),
                StringUtils.normalizeSpace(cells.get(DECISION_NUMBER_CELL).text()),
                StringUtils.normalizeSpace(cells.get(DECISION_DATE_CELL).text()));
        if (StringUtils.isAnyBlank(fields.chamber, fields.caseNumber)) {
            throw new RowExtractionException("row without chamber or case number");
        }
        return fields;
    }

    String caseId() {
        return ResultItem.caseId(caseNumber, decisionNumber);
    }

    ResultItem toResultItem(final String decisionText, final String keyword) {
        return new ResultItem(chamber, caseNumber, decisionNumber, decisionDate, decisionText, keyword);
    }
}
