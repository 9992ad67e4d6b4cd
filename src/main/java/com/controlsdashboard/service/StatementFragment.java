package com.controlsdashboard.service;

import java.util.List;

/**
 * One paragraph of a flattened part tree.
 *
 * @param path  ids of the enclosing parts, outermost first, including the owning part's own id
 * @param id    owning part id
 * @param name  owning part name
 * @param label owning part's {@code label} prop value, e.g. {@code a.}
 * @param text  reconstructed paragraph text
 * @param depth nesting depth below the part the flattening started from
 */
public record StatementFragment(
        List<String> path,
        String id,
        String name,
        String label,
        String text,
        int depth
) {
}
