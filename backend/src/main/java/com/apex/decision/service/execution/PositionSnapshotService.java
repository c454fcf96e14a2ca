package com.apex.decision.service.execution;

import com.apex.decision.cache.DecisionCaches;
import com.apex.decision.model.PositionSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
@RequiredArgsConstructor
public class PositionSnapshotService {

    private final ExecutionGateway executionGateway;
    private final DecisionCaches caches;

    public PositionSnapshot snapshot(String symbol) {
        Optional<PositionSnapshot> cached = caches.getPositions().get(symbol);
        if (cached.isPresent()) {
            return cached.get();
        }
        return refresh(symbol);
    }

    public PositionSnapshot refresh(String symbol) {
        PositionSnapshot snapshot = PositionSnapshot.from(symbol, executionGateway.openPositions(symbol));
        caches.getPositions().put(symbol, snapshot);
        return snapshot;
    }
}
