package dev.pekelund.spandana.intake;

import dev.pekelund.spandana.complaints.Classification;
import dev.pekelund.spandana.complaints.ComplaintClassifier;
import dev.pekelund.spandana.complaints.ComplaintDetails;
import dev.pekelund.spandana.complaints.ComplaintIdentity;
import dev.pekelund.spandana.complaints.ComplaintRecord;
import dev.pekelund.spandana.complaints.ComplaintTicket;
import dev.pekelund.spandana.complaints.ComplaintTimestamps;
import dev.pekelund.spandana.ledger.ComplaintLedger;
import dev.pekelund.spandana.ledger.DuplicateCheck;
import dev.pekelund.spandana.ledger.LedgerStorageException;
import dev.pekelund.spandana.messaging.SessionHandoffStore;
import dev.pekelund.spandana.tickets.TicketAllocator;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Turns a reviewed set of answers into a stored complaint: duplicate check,
 * classification, ticket allocation and the ledger writes.
 */
@Service
public class ComplaintSubmissionService {

    private static final Logger log = LoggerFactory.getLogger(ComplaintSubmissionService.class);

    private final ComplaintLedger ledger;
    private final ComplaintClassifier classifier;
    private final TicketAllocator ticketAllocator;
    private final SessionHandoffStore sessionStore;
    private final Clock clock;

    public ComplaintSubmissionService(
        ComplaintLedger ledger,
        ComplaintClassifier classifier,
        TicketAllocator ticketAllocator,
        SessionHandoffStore sessionStore,
        Clock clock
    ) {
        this.ledger = ledger;
        this.classifier = classifier;
        this.ticketAllocator = ticketAllocator;
        this.sessionStore = sessionStore;
        this.clock = clock;
    }

    /**
     * The identity complaints are filed under: the handed-over session, or the
     * {@code N/A} placeholder when there is none.
     */
    public ComplaintIdentity currentIdentity() {
        return sessionStore.read()
            .map(session -> new ComplaintIdentity(session.username(), session.passwordHash()))
            .orElseGet(ComplaintIdentity::anonymous);
    }

    public SubmissionResult submit(ComplaintDetails details) {
        for (Map.Entry<String, String> field : requiredFields(details).entrySet()) {
            if (!StringUtils.hasText(field.getValue())) {
                return SubmissionResult.incomplete("Please provide " + field.getKey() + ".");
            }
        }

        ComplaintIdentity identity = currentIdentity();
        try {
            if (identity.isAuthenticated()) {
                DuplicateCheck duplicate = ledger.findDuplicate(identity, details.complaintType());
                if (duplicate.duplicate()) {
                    log.info("Rejected duplicate '{}' complaint from '{}' (existing ticket {})",
                        details.complaintType(), identity.username(), duplicate.existingTicketId());
                    return SubmissionResult.duplicate(duplicate.existingTicketId());
                }
            } else {
                log.debug("No session identity; skipping duplicate check");
            }

            Classification classification = classifier.classify(details.complaintType(), details.description());
            String ticketId = ticketAllocator.next();
            ComplaintRecord record = ComplaintRecord.open(identity, details, ticketId,
                classification.department(), ComplaintTimestamps.now(clock));
            ledger.append(record, classification.urgency());
            log.info("Ticket {} issued to {} with {} urgency", ticketId,
                classification.department().displayName(), classification.urgency().displayName());
            return SubmissionResult.submitted(ComplaintTicket.of(record, classification));
        } catch (LedgerStorageException ex) {
            log.error("Failed to save complaint", ex);
            return SubmissionResult.failed("Failed to save complaint data. Please try again. (" + ex.getMessage() + ")");
        }
    }

    private static Map<String, String> requiredFields(ComplaintDetails details) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(IntakeField.NAME.label(), details.name());
        fields.put(IntakeField.MOBILE_NUMBER.label(), details.mobileNumber());
        fields.put(IntakeField.LOCATION.label(), details.location());
        fields.put(IntakeField.COMPLAINT_TYPE.label(), details.complaintType());
        fields.put(IntakeField.COMPLAINT_DESCRIPTION.label(), details.description());
        return fields;
    }
}
