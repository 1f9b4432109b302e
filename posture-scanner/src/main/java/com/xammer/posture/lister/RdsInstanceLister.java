package com.xammer.posture.lister;

import com.xammer.posture.domain.Resource;
import com.xammer.posture.domain.ServiceType;
import com.xammer.posture.rules.RdsRules;
import software.amazon.awssdk.services.rds.RdsClient;
import software.amazon.awssdk.services.rds.model.DBInstance;

import java.util.stream.Stream;

public class RdsInstanceLister implements ResourceLister {

    private final RdsClient rds;

    public RdsInstanceLister(RdsClient rds) {
        this.rds = rds;
    }

    @Override
    public Stream<Resource> list() {
        return rds.describeDBInstancesPaginator().dbInstances().stream().map(RdsInstanceLister::toResource);
    }

    static Resource toResource(DBInstance db) {
        return Resource.builder(ServiceType.RDS, RdsRules.DB_INSTANCE, db.dbInstanceIdentifier())
                .attribute(RdsRules.ENGINE, db.engine())
                .attribute(RdsRules.PUBLICLY_ACCESSIBLE, db.publiclyAccessible())
                .attribute(RdsRules.STORAGE_ENCRYPTED, db.storageEncrypted())
                .attribute(RdsRules.BACKUP_RETENTION_PERIOD, db.backupRetentionPeriod())
                .build();
    }
}
