package com.vidnyan.guardian.application.port.out;

import com.vidnyan.guardian.domain.policy.CompliancePolicy;

/**
 * Port for loading the compliance policy.
 */
public interface PolicyRepository {

    /**
     * The configured policy, or a permissive one when none is configured.
     */
    CompliancePolicy load();
}
