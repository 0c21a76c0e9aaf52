package dev.pekelund.spandana.ledger;

import java.util.List;

/**
 * Canonical column layout of the master and department ledgers.
 */
final class LedgerColumns {

    static final String USERNAME = "Username";
    static final String PASSWORD_HASH = "Password_Hash";
    static final String NAME = "Name";
    static final String MOBILE_NUMBER = "Mobile Number";
    static final String LOCATION = "Location";
    static final String COMPLAINT_TYPE = "Complaint Type";
    static final String COMPLAINT_DESCRIPTION = "Complaint Description";
    static final String TICKET_ID = "Ticket ID";
    static final String STATUS = "Status";
    static final String TICKET_ALIVE = "Ticket Alive";
    static final String TIMESTAMP = "Timestamp";
    static final String LAST_UPDATED = "Last_Updated";
    static final String ASSIGNED_DEPARTMENT = "Assigned Department";
    static final String URGENCY_LEVEL = "Urgency Level";

    static final List<String> MASTER_HEADER = List.of(
        USERNAME,
        PASSWORD_HASH,
        NAME,
        MOBILE_NUMBER,
        LOCATION,
        COMPLAINT_TYPE,
        COMPLAINT_DESCRIPTION,
        TICKET_ID,
        STATUS,
        TICKET_ALIVE,
        TIMESTAMP,
        LAST_UPDATED,
        ASSIGNED_DEPARTMENT);

    static final List<String> DEPARTMENT_HEADER = List.of(
        TICKET_ID,
        USERNAME,
        NAME,
        MOBILE_NUMBER,
        LOCATION,
        COMPLAINT_TYPE,
        COMPLAINT_DESCRIPTION,
        STATUS,
        URGENCY_LEVEL,
        TIMESTAMP,
        LAST_UPDATED);

    private LedgerColumns() {
    }

    static int masterIndex(String column) {
        return MASTER_HEADER.indexOf(column);
    }

    static int departmentIndex(String column) {
        return DEPARTMENT_HEADER.indexOf(column);
    }
}
