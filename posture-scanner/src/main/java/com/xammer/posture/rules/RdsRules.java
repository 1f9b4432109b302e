package com.xammer.posture.rules;

import com.xammer.posture.domain.Severity;
import com.xammer.posture.engine.MissingAttributePolicy;
import com.xammer.posture.engine.Rule;

import java.util.List;

public final class RdsRules {

    public static final String DB_INSTANCE = "db-instance";

    public static final String PUBLICLY_ACCESSIBLE = "publiclyAccessible";
    public static final String STORAGE_ENCRYPTED = "storageEncrypted";
    public static final String BACKUP_RETENTION_PERIOD = "backupRetentionPeriod";
    public static final String ENGINE = "engine";

    public static final Rule PUBLICLY_ACCESSIBLE_INSTANCE = Rule.builder("rds-publicly-accessible")
            .inspects(PUBLICLY_ACCESSIBLE, MissingAttributePolicy.FAIL_OPEN)
            .triggersWhen(r -> r.bool(PUBLICLY_ACCESSIBLE).orElse(false))
            .message("RDS instance {id} is publicly accessible.")
            .severity(Severity.HIGH)
            .build();

    public static final Rule STORAGE_NOT_ENCRYPTED = Rule.builder("rds-storage-not-encrypted")
            .inspects(STORAGE_ENCRYPTED, MissingAttributePolicy.FAIL_CLOSED)
            .triggersWhen(r -> !r.bool(STORAGE_ENCRYPTED).orElse(false))
            .message("RDS instance {id}: storage encryption is not enabled.")
            .severity(Severity.HIGH)
            .build();

    // An unreported retention period is read as 0 days.
    public static final Rule NO_BACKUP_RETENTION = Rule.builder("rds-no-backup-retention")
            .inspects(BACKUP_RETENTION_PERIOD, MissingAttributePolicy.FAIL_CLOSED)
            .triggersWhen(r -> r.integer(BACKUP_RETENTION_PERIOD).orElse(0) == 0)
            .message("RDS instance {id}: no backup retention configured.")
            .severity(Severity.WARNING)
            .build();

    public static final List<Rule> DB_INSTANCE_RULES = List.of(
            PUBLICLY_ACCESSIBLE_INSTANCE,
            STORAGE_NOT_ENCRYPTED,
            NO_BACKUP_RETENTION);

    private RdsRules() {
    }
}
