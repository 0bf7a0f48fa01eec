package com.syntharb.domain.model;

import com.syntharb.domain.enums.PositionStatus;
import java.util.List;
import java.util.Objects;
import lombok.Builder;
import lombok.Value;

/**
 * Optional criteria for listing positions. Null fields match everything; tags match
 * if the position carries any of them.
 */
@Value
@Builder
public class PositionFilter {

    public static final PositionFilter ALL = PositionFilter.builder().build();

    PositionStatus status;
    String sport;
    String assignedTo;
    List<String> tags;

    public boolean matches(SyntheticPosition position) {
        if (status != null && status != position.getStatus()) {
            return false;
        }
        if (sport != null && !sport.equals(position.getSport())) {
            return false;
        }
        PositionMetadata metadata = position.getMetadata();
        if (assignedTo != null
                && (metadata == null || !Objects.equals(assignedTo, metadata.getAssignedTo()))) {
            return false;
        }
        return tags == null || tags.isEmpty() || (metadata != null && metadata.hasAnyTag(tags));
    }
}
