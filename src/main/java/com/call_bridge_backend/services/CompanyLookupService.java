package com.call_bridge_backend.services;

import com.call_bridge_backend.models.BusinessConfig;

import java.util.Optional;

/**
 * Resolves the business that owns a dialed number.
 */
public interface CompanyLookupService {

    Optional<BusinessConfig> findByPhoneNumber(String destinationNumber);
}
