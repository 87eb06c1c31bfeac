package com.investbyyourself.etl.dto;

import com.investbyyourself.etl.model.BackendKind;
import com.investbyyourself.etl.model.DataVersion;

import java.util.List;
import java.util.Map;

/**
 * @param current     newest version per backend that has one
 * @param unavailable backends whose lookup failed, with the reason
 * @param history     audited versions, newest first
 */
public record VersionView(String dataset,
                          String scopeKey,
                          Map<BackendKind, DataVersion> current,
                          Map<BackendKind, String> unavailable,
                          List<DataVersion> history) {
}
