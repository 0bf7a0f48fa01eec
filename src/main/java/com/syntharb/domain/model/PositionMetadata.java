package com.syntharb.domain.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Free-form annotations attached to a position.
 *
 * <p>The well-known keys are typed fields (notes, tags, assignedTo). Anything else
 * goes into {@code extra}, which is carried through untouched.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PositionMetadata {

    private String notes;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    private String assignedTo;

    @Builder.Default
    private Map<String, Object> extra = new LinkedHashMap<>();

    public static PositionMetadata empty() {
        return PositionMetadata.builder().build();
    }

    public boolean hasAnyTag(List<String> candidates) {
        return tags != null && candidates.stream().anyMatch(tags::contains);
    }

    public PositionMetadata copy() {
        return toBuilder()
                .tags(tags != null ? new ArrayList<>(tags) : new ArrayList<>())
                .extra(extra != null ? new LinkedHashMap<>(extra) : new LinkedHashMap<>())
                .build();
    }
}
