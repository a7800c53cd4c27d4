package com.fetchman.dto.response;

import java.util.List;

/**
 * @param placeholders Every identifier referenced by the draft, in order of first appearance.
 * @param missing      The subset that the workspace variables do not define.
 */
public record PlaceholderReport(List<String> placeholders, List<String> missing) {
}
