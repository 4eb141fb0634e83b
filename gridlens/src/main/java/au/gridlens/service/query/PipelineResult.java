package au.gridlens.service.query;

import au.gridlens.domain.model.CoverageStatus;
import au.gridlens.service.annualise.EnergySeries;

/**
 * Cached value of one query: annual energy plus the coverage of the unified input.
 */
public record PipelineResult(EnergySeries energy, CoverageStatus coverage) {
}
