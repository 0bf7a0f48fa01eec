package com.syntharb.api.controller;

import com.syntharb.api.dto.request.AddPositionRequest;
import com.syntharb.api.dto.request.ClosePositionRequest;
import com.syntharb.api.dto.request.LegFillRequest;
import com.syntharb.domain.enums.PositionStatus;
import com.syntharb.domain.model.PositionFilter;
import com.syntharb.domain.model.SyntheticPosition;
import com.syntharb.tracker.PositionTracker;
import jakarta.validation.Valid;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for the synthetic position lifecycle.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/positions -- open a position from an opportunity</li>
 *   <li>GET /api/positions -- list positions, newest first, filtered by status/sport/assignee/tags</li>
 *   <li>GET /api/positions/{id} -- single position</li>
 *   <li>POST /api/positions/{id}/legs/{legIndex}/fill -- record a leg execution</li>
 *   <li>POST /api/positions/{id}/close -- close with a reason and realized PnL</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/positions")
public class PositionController {

    private static final Logger log = LoggerFactory.getLogger(PositionController.class);

    private final PositionTracker positionTracker;

    public PositionController(PositionTracker positionTracker) {
        this.positionTracker = positionTracker;
    }

    @PostMapping
    public ResponseEntity<SyntheticPosition> addPosition(@Valid @RequestBody AddPositionRequest request) {
        SyntheticPosition position = positionTracker.addPosition(request.getOpportunity(), request.getMetadata());
        return ResponseEntity.status(HttpStatus.CREATED).body(position);
    }

    @GetMapping
    public ResponseEntity<List<SyntheticPosition>> getPositions(
            @RequestParam(required = false) PositionStatus status,
            @RequestParam(required = false) String sport,
            @RequestParam(required = false) String assignedTo,
            @RequestParam(required = false) List<String> tags) {
        PositionFilter filter = PositionFilter.builder()
                .status(status)
                .sport(sport)
                .assignedTo(assignedTo)
                .tags(tags)
                .build();
        return ResponseEntity.ok(positionTracker.getPositions(filter));
    }

    @GetMapping("/{positionId}")
    public ResponseEntity<SyntheticPosition> getPosition(@PathVariable String positionId) {
        return ResponseEntity.ok(positionTracker.getPosition(positionId));
    }

    @PostMapping("/{positionId}/legs/{legIndex}/fill")
    public ResponseEntity<SyntheticPosition> fillLeg(
            @PathVariable String positionId,
            @PathVariable int legIndex,
            @Valid @RequestBody LegFillRequest request) {
        log.debug("Leg fill for {} leg {}: {}", positionId, legIndex, request);
        return ResponseEntity.ok(positionTracker.updateLegExecution(positionId, legIndex, request.toLegFill()));
    }

    @PostMapping("/{positionId}/close")
    public ResponseEntity<SyntheticPosition> closePosition(
            @PathVariable String positionId, @Valid @RequestBody ClosePositionRequest request) {
        return ResponseEntity.ok(
                positionTracker.closePosition(positionId, request.getReason(), request.getRealizedPnl()));
    }
}
