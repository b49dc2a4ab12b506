package com.safejob.matching.processors;

import com.safejob.matching.dto.enums.ActorType;
import com.safejob.matching.dto.enums.ApplicationStatus;
import com.safejob.matching.dto.enums.CoupleApplicationStatus;
import com.safejob.matching.exceptions.InvalidTransitionException;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.safejob.matching.dto.enums.ActorType.CANDIDATE;
import static com.safejob.matching.dto.enums.ActorType.EMPLOYER;
import static com.safejob.matching.dto.enums.ActorType.SYSTEM;
import static com.safejob.matching.dto.enums.ApplicationStatus.*;

/**
 * Single source of truth for which status changes are legal, and who may trigger them.
 * <p>
 * Callers check a transition here before writing anything, so a rejected transition leaves the
 * record exactly as it was.
 * </p>
 */
@Component
public class ApplicationStateMachine {

    private static final Map<ApplicationStatus, Map<ApplicationStatus, Set<ActorType>>> TABLE = buildTable();
    private static final Map<CoupleApplicationStatus, Set<CoupleApplicationStatus>> COUPLE_TABLE = buildCoupleTable();

    public boolean canTransition(ApplicationStatus from, ApplicationStatus to, ActorType actor) {
        Map<ApplicationStatus, Set<ActorType>> targets = TABLE.get(from);
        if (targets == null) return false;
        Set<ActorType> actors = targets.get(to);
        return actors != null && actors.contains(actor);
    }

    public void assertTransition(ApplicationStatus from, ApplicationStatus to, ActorType actor) {
        if (!canTransition(from, to, actor)) {
            throw new InvalidTransitionException(from, to, actor);
        }
    }

    public Set<ApplicationStatus> allowedTargets(ApplicationStatus from) {
        Map<ApplicationStatus, Set<ActorType>> targets = TABLE.get(from);
        return targets == null ? Set.of() : Collections.unmodifiableSet(targets.keySet());
    }

    public boolean canTransition(CoupleApplicationStatus from, CoupleApplicationStatus to) {
        return COUPLE_TABLE.getOrDefault(from, Set.of()).contains(to);
    }

    public void assertTransition(CoupleApplicationStatus from, CoupleApplicationStatus to, ActorType actor) {
        if (!canTransition(from, to)) {
            throw new InvalidTransitionException(from, to, actor);
        }
    }

    /**
     * Couple outcome once both partners' applications have been decided; {@code SUBMITTED} while
     * either is still in progress.
     */
    public CoupleApplicationStatus project(ApplicationStatus a, ApplicationStatus b) {
        if (!a.isTerminal() || !b.isTerminal()) {
            return CoupleApplicationStatus.SUBMITTED;
        }
        if (a == ACCEPTED && b == ACCEPTED) return CoupleApplicationStatus.BOTH_ACCEPTED;
        if (a == ACCEPTED || b == ACCEPTED) return CoupleApplicationStatus.SPLIT_DECISION;
        if (a == WITHDRAWN && b == WITHDRAWN) return CoupleApplicationStatus.WITHDRAWN;
        return CoupleApplicationStatus.BOTH_REJECTED;
    }

    private static Map<ApplicationStatus, Map<ApplicationStatus, Set<ActorType>>> buildTable() {
        Map<ApplicationStatus, Map<ApplicationStatus, Set<ActorType>>> table = new EnumMap<>(ApplicationStatus.class);

        allow(table, DRAFT, SUBMITTED, CANDIDATE);
        allow(table, DRAFT, AWAITING_PARTNER, CANDIDATE);
        allow(table, AWAITING_PARTNER, SUBMITTED, CANDIDATE);

        allow(table, SUBMITTED, VIEWED, EMPLOYER);
        allow(table, VIEWED, IN_REVIEW, EMPLOYER);
        allow(table, IN_REVIEW, INTERVIEW_SCHEDULED, EMPLOYER);
        allow(table, IN_REVIEW, REJECTED, EMPLOYER);
        allow(table, INTERVIEW_SCHEDULED, OFFERED, EMPLOYER);
        allow(table, INTERVIEW_SCHEDULED, REJECTED, EMPLOYER);
        allow(table, OFFERED, ACCEPTED, EMPLOYER);
        allow(table, OFFERED, REJECTED, EMPLOYER);

        for (ApplicationStatus status : ApplicationStatus.values()) {
            if (!status.isTerminal()) {
                allow(table, status, WITHDRAWN, CANDIDATE);
            }
        }
        // deadline expiry of a couple confirmation
        allow(table, DRAFT, WITHDRAWN, SYSTEM);
        allow(table, AWAITING_PARTNER, WITHDRAWN, SYSTEM);
        return table;
    }

    private static void allow(Map<ApplicationStatus, Map<ApplicationStatus, Set<ActorType>>> table,
                              ApplicationStatus from, ApplicationStatus to, ActorType actor) {
        table.computeIfAbsent(from, k -> new EnumMap<>(ApplicationStatus.class))
                .computeIfAbsent(to, k -> EnumSet.noneOf(ActorType.class))
                .add(actor);
    }

    private static Map<CoupleApplicationStatus, Set<CoupleApplicationStatus>> buildCoupleTable() {
        Map<CoupleApplicationStatus, Set<CoupleApplicationStatus>> table = new EnumMap<>(CoupleApplicationStatus.class);
        table.put(CoupleApplicationStatus.DRAFT, EnumSet.of(
                CoupleApplicationStatus.AWAITING_PARTNER, CoupleApplicationStatus.WITHDRAWN));
        table.put(CoupleApplicationStatus.AWAITING_PARTNER, EnumSet.of(
                CoupleApplicationStatus.SUBMITTED, CoupleApplicationStatus.WITHDRAWN));
        table.put(CoupleApplicationStatus.SUBMITTED, EnumSet.of(
                CoupleApplicationStatus.BOTH_ACCEPTED, CoupleApplicationStatus.BOTH_REJECTED,
                CoupleApplicationStatus.SPLIT_DECISION, CoupleApplicationStatus.WITHDRAWN));
        return table;
    }
}
