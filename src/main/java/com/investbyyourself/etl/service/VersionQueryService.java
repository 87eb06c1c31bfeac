package com.investbyyourself.etl.service;

import com.investbyyourself.etl.dto.VersionView;
import com.investbyyourself.etl.model.BackendKind;
import com.investbyyourself.etl.model.DataVersion;
import com.investbyyourself.etl.model.DataVersionAudit;
import com.investbyyourself.etl.repository.DataVersionAuditRepository;
import com.investbyyourself.etl.service.loader.LoaderService;
import com.investbyyourself.etl.service.loader.StorageBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the current {@link DataVersion} of a scope from each backend together with the
 * audit trail of earlier versions.
 */
@Service
public class VersionQueryService {

    private static final Logger logger = LoggerFactory.getLogger(VersionQueryService.class);

    private final LoaderService loaderService;
    private final DataVersionAuditRepository auditRepository;

    public VersionQueryService(LoaderService loaderService, DataVersionAuditRepository auditRepository) {
        this.loaderService = loaderService;
        this.auditRepository = auditRepository;
    }

    public VersionView versions(String dataset, String scopeKey) {
        if (dataset == null || dataset.isBlank() || scopeKey == null || scopeKey.isBlank()) {
            throw new IllegalArgumentException("dataset and scope are required");
        }
        Map<BackendKind, DataVersion> current = new EnumMap<>(BackendKind.class);
        Map<BackendKind, String> unavailable = new EnumMap<>(BackendKind.class);
        for (Map.Entry<BackendKind, StorageBackend> entry : loaderService.backends().entrySet()) {
            try {
                entry.getValue().getVersion(dataset, scopeKey).ifPresent(v -> current.put(entry.getKey(), v));
            } catch (EtlException e) {
                logger.warn("backend={} dataset={} scope={} version lookup failed: {}",
                        entry.getKey(), dataset, scopeKey, e.getMessage());
                unavailable.put(entry.getKey(), e.getMessage());
            }
        }
        List<DataVersion> history = auditRepository
                .findAllByDatasetAndScopeKeyOrderByCreatedAtDesc(dataset, scopeKey)
                .stream()
                .map(DataVersionAudit::toDataVersion)
                .toList();
        return new VersionView(dataset, scopeKey, current, unavailable, history);
    }
}
