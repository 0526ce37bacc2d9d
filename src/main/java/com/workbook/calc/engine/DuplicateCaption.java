package com.workbook.calc.engine;

import java.util.List;

/**
 * A caption declared by more than one calculation.
 *
 * @param caption     the shared caption
 * @param datasources owning datasource of each declaration, in declaration order
 * @param resolvedTo  datasource of the declaration that bare references resolve to
 */
public record DuplicateCaption(String caption, List<String> datasources, String resolvedTo) {
}
