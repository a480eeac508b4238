package com.unihousing.backend.modules.clearance.presentation.dto;

import java.time.OffsetDateTime;

import com.unihousing.backend.modules.clearance.domain.ClearanceProcess;
import com.unihousing.backend.modules.clearance.domain.ClearanceProgress;
import com.unihousing.backend.modules.clearance.domain.ClearanceStatus;

public record ClearanceResponse(
        Long id,
        ClearanceStatus status,
        boolean roomCheckPassed,
        boolean keysReturned,
        int percentage,
        OffsetDateTime initiatedAt
) {

    public static ClearanceResponse notInitiated() {
        ClearanceProgress progress = ClearanceProgress.notInitiated();
        return new ClearanceResponse(null, progress.status(), false, false, progress.percentage(), null);
    }

    public static ClearanceResponse from(ClearanceProcess process) {
        ClearanceProgress progress = process.progress();
        return new ClearanceResponse(
                process.getId(),
                progress.status(),
                progress.roomCheckPassed(),
                progress.keysReturned(),
                progress.percentage(),
                process.getInitiatedAt()
        );
    }
}
