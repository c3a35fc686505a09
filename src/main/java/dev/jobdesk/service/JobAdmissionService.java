package dev.jobdesk.service;

import dev.jobdesk.exception.InvalidInputException;
import dev.jobdesk.model.Job;
import dev.jobdesk.model.Project;
import dev.jobdesk.model.ProjectKeys;
import dev.jobdesk.store.JobCheckoutService;
import dev.jobdesk.store.JobRecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Brings new jobs into the desk from unassigned work order lines.
 *
 * <p>Runs on a worker thread so the caller stays responsive, but touches the
 * store exactly like an interactive user: one job at a time, create, lock,
 * fill, save, release.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobAdmissionService {

    private final JobRecordStore store;
    private final JobCheckoutService checkoutService;

    /**
     * @return Mono with the created and skipped job numbers; errors with
     *         {@link InvalidInputException} when every line belongs to an
     *         existing job
     */
    public Mono<AdmissionResult> admit(List<WorkOrderLine> lines) {
        return Mono.fromCallable(() -> partition(lines))
                .flatMap(plan -> Flux.fromIterable(plan.pending().entrySet())
                        .concatMap(entry -> Mono.fromCallable(() -> admitJob(entry.getKey(), entry.getValue())))
                        .doOnNext(jobNumber -> log.info("{} created successfully...", jobNumber))
                        .collectList()
                        .map(created -> new AdmissionResult(created, plan.skipped())))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private record Plan(Map<String, List<WorkOrderLine>> pending, List<String> skipped) {
    }

    private Plan partition(List<WorkOrderLine> lines) {
        Set<String> active = store.listActive();
        Map<String, List<WorkOrderLine>> pending = new LinkedHashMap<>();
        List<String> skipped = new ArrayList<>();
        for (WorkOrderLine line : lines) {
            String jobNumber = ProjectKeys.jobNumberOf(line.aliasNumber());
            if (active.contains(jobNumber)) {
                if (!skipped.contains(jobNumber)) {
                    skipped.add(jobNumber);
                }
                continue;
            }
            pending.computeIfAbsent(jobNumber, k -> new ArrayList<>()).add(line);
        }
        if (pending.isEmpty()) {
            throw new InvalidInputException("No unassigned jobs were found.");
        }
        log.info("Admitting {} job(s), {} already active", pending.size(), skipped.size());
        return new Plan(pending, skipped);
    }

    private String admitJob(String jobNumber, List<WorkOrderLine> lines) {
        checkoutService.create(jobNumber, null);
        Job job = checkoutService.checkout(jobNumber);
        try {
            for (WorkOrderLine line : lines) {
                job.addProject(line.aliasNumber(), line.workInstructions(), Project.UNASSIGNED_OWNER, line.dueDate());
            }
            checkoutService.save(job);
        } finally {
            checkoutService.release(jobNumber);
        }
        return jobNumber;
    }
}
