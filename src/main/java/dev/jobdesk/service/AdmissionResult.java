package dev.jobdesk.service;

import java.util.List;

/**
 * @param created jobs created by this run
 * @param skipped jobs left alone because they already had records
 */
public record AdmissionResult(List<String> created, List<String> skipped) {
}
