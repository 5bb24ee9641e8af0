package com.example.einvoice.lifecycle;

import com.example.einvoice.domain.InvoiceStatus;
import com.example.einvoice.domain.LifecycleEvent;
import com.example.einvoice.domain.PartyRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.example.einvoice.domain.InvoiceStatus.*;

/**
 * Lifecycle state machine of a single invoice (AFNOR XP Z12-012).
 *
 * Emission:    DEPOSITED → EMITTED → RECEIVED → MADE_AVAILABLE → TAKEN_IN_CHARGE
 * Buyer side:  TAKEN_IN_CHARGE → APPROVED | PARTIALLY_APPROVED | DISPUTED | SUSPENDED | REFUSED
 * Payment:     APPROVED → PAYMENT_TRANSMITTED → COLLECTED
 *
 * Terminal states: REJECTED_AT_EMISSION, REJECTED_AT_RECEPTION, REFUSED, COLLECTED.
 *
 * Not thread-safe: callers sharing an instance must serialise access.
 */
public class LifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(LifecycleManager.class);

    private static final Map<InvoiceStatus, Set<InvoiceStatus>> TRANSITIONS = new EnumMap<>(InvoiceStatus.class);

    static {
        TRANSITIONS.put(DEPOSITED, EnumSet.of(EMITTED, REJECTED_AT_EMISSION));
        TRANSITIONS.put(EMITTED, EnumSet.of(RECEIVED, REJECTED_AT_RECEPTION));
        TRANSITIONS.put(RECEIVED, EnumSet.of(MADE_AVAILABLE, REJECTED_AT_RECEPTION));
        TRANSITIONS.put(MADE_AVAILABLE, EnumSet.of(TAKEN_IN_CHARGE, REJECTED_AT_RECEPTION));
        TRANSITIONS.put(TAKEN_IN_CHARGE, EnumSet.of(APPROVED, PARTIALLY_APPROVED, REFUSED, DISPUTED, SUSPENDED));
        TRANSITIONS.put(APPROVED, EnumSet.of(PAYMENT_TRANSMITTED, COLLECTED));
        TRANSITIONS.put(PARTIALLY_APPROVED, EnumSet.of(PAYMENT_TRANSMITTED, REFUSED, DISPUTED));
        TRANSITIONS.put(DISPUTED, EnumSet.of(APPROVED, REFUSED, SUSPENDED));
        TRANSITIONS.put(SUSPENDED, EnumSet.of(COMPLETED));
        TRANSITIONS.put(COMPLETED, EnumSet.of(TAKEN_IN_CHARGE));
        TRANSITIONS.put(PAYMENT_TRANSMITTED, EnumSet.of(COLLECTED));
        TRANSITIONS.put(REJECTED_AT_EMISSION, EnumSet.noneOf(InvoiceStatus.class));
        TRANSITIONS.put(REJECTED_AT_RECEPTION, EnumSet.noneOf(InvoiceStatus.class));
        TRANSITIONS.put(REFUSED, EnumSet.noneOf(InvoiceStatus.class));
        TRANSITIONS.put(COLLECTED, EnumSet.noneOf(InvoiceStatus.class));
    }

    private final String invoiceReference;
    private final Clock clock;
    private final List<LifecycleEvent> history = new ArrayList<>();
    private InvoiceStatus status;

    public LifecycleManager(String invoiceReference) {
        this(invoiceReference, DEPOSITED, Clock.systemUTC());
    }

    public LifecycleManager(String invoiceReference, InvoiceStatus initialStatus) {
        this(invoiceReference, initialStatus, Clock.systemUTC());
    }

    public LifecycleManager(String invoiceReference, InvoiceStatus initialStatus, Clock clock) {
        if (initialStatus == null) {
            throw new IllegalArgumentException("Initial status is required");
        }
        this.invoiceReference = invoiceReference;
        this.status = initialStatus;
        this.clock = clock;
    }

    public boolean canTransition(InvoiceStatus target) {
        return allowedTransitions().contains(target);
    }

    public LifecycleEvent transition(InvoiceStatus target) {
        return transition(target, null, null, null, null);
    }

    public LifecycleEvent transition(InvoiceStatus target, String reason) {
        return transition(target, reason, null, null, null);
    }

    /**
     * Moves the invoice to {@code target} and records the event.
     *
     * @param producer Actor emitting the status, defaults to the status' usual producer
     * @param amount Cashed amount for a partial collection
     * @throws InvalidTransitionException if the edge does not exist or a refusal has no reason
     */
    public LifecycleEvent transition(InvoiceStatus target, String reason, String reasonCode,
                                     PartyRole producer, BigDecimal amount) {
        if (target == null) {
            throw new InvalidTransitionException(status, null, "Target status is required");
        }
        if (!canTransition(target)) {
            throw new InvalidTransitionException(status, target, String.format(
                "Transition not allowed: %d → %d. Allowed: %s",
                status.getCode(), target.getCode(), codes(allowedTransitions())));
        }
        if (target.isReasonRequired() && (reason == null || reason.isBlank())) {
            throw new InvalidTransitionException(status, target,
                "Status " + target.getCode() + " (" + target + ") requires a reason");
        }

        LifecycleEvent event = new LifecycleEvent(
            target,
            clock.instant(),
            reason,
            reasonCode,
            producer != null ? producer : target.getDefaultProducer(),
            amount
        );
        InvoiceStatus previous = status;
        status = target;
        history.add(event);
        log.info("Invoice {} transitioned: {} → {}", invoiceReference, previous.getCode(), target.getCode());
        return event;
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(status).isEmpty();
    }

    public Set<InvoiceStatus> allowedTransitions() {
        return Collections.unmodifiableSet(TRANSITIONS.get(status));
    }

    public boolean isMandatory(InvoiceStatus candidate) {
        return candidate.isMandatory();
    }

    /**
     * @return Recorded events that must be reported to the tax administration
     */
    public List<LifecycleEvent> mandatoryEvents() {
        return history.stream().filter(e -> e.status().isMandatory()).toList();
    }

    public List<LifecycleEvent> getHistory() {
        return Collections.unmodifiableList(history);
    }

    public InvoiceStatus getStatus() {
        return status;
    }

    public String getInvoiceReference() {
        return invoiceReference;
    }

    private static List<Integer> codes(Set<InvoiceStatus> statuses) {
        return statuses.stream().map(InvoiceStatus::getCode).toList();
    }
}
