package com.example.securitycore.access;

import com.example.securitycore.models.AuditEntry;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Expression;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.PutItemEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;
import software.amazon.awssdk.enhanced.dynamodb.model.ScanEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;

@Component
@ConditionalOnProperty(name = "storage.backend", havingValue = "dynamo", matchIfMissing = true)
public class DynamoAuditEntryAccess implements AuditEntryAccess {

    public static final String TABLE_NAME = "audit_entries";

    private final DynamoDbTable<AuditEntry> table;

    public DynamoAuditEntryAccess(DynamoDbEnhancedClient enhancedClient) {
        this.table = enhancedClient.table(TABLE_NAME, TableSchema.fromBean(AuditEntry.class));
    }

    @Override
    public void append(AuditEntry entry) {
        Expression slotIsFree = Expression.builder()
                .expression("attribute_not_exists(tenant_id)")
                .build();
        try {
            table.putItem(PutItemEnhancedRequest.builder(AuditEntry.class)
                    .item(entry)
                    .conditionExpression(slotIsFree)
                    .build());
        } catch (ConditionalCheckFailedException ex) {
            throw new ChainConflictException(entry.getTenantId(), entry.getSequence(), ex);
        }
    }

    @Override
    public Optional<AuditEntry> findLatest(String tenantId) {
        // Highest sequence first.
        return table.query(r -> r.queryConditional(QueryConditional.keyEqualTo(partition(tenantId)))
                        .limit(1)
                        .scanIndexForward(false))
                .items()
                .stream()
                .findFirst();
    }

    @Override
    public List<AuditEntry> findRange(String tenantId, long fromSequence, long toSequence) {
        QueryConditional between = QueryConditional.sortBetween(
                Key.builder().partitionValue(tenantId).sortValue(fromSequence).build(),
                Key.builder().partitionValue(tenantId).sortValue(toSequence).build());
        return table.query(r -> r.queryConditional(between).scanIndexForward(true))
                .items()
                .stream()
                .collect(Collectors.toList());
    }

    @Override
    public List<AuditEntry> findByTimeRange(String tenantId, long startTimestamp, long endTimestamp) {
        Expression filterExpression = Expression.builder()
                .expression("#ts >= :start AND #ts < :end")
                .putExpressionName("#ts", "timestamp")
                .putExpressionValue(":start", AttributeValue.builder().n(String.valueOf(startTimestamp)).build())
                .putExpressionValue(":end", AttributeValue.builder().n(String.valueOf(endTimestamp)).build())
                .build();
        return table.query(r -> r.queryConditional(QueryConditional.keyEqualTo(partition(tenantId)))
                        .filterExpression(filterExpression)
                        .scanIndexForward(true))
                .items()
                .stream()
                .collect(Collectors.toList());
    }

    @Override
    public List<AuditEntry> findEntriesOlderThan(long cutoffTimestamp) {
        Expression filterExpression = Expression.builder()
                .expression("#ts < :cutoff")
                .putExpressionName("#ts", "timestamp")
                .putExpressionValue(":cutoff", AttributeValue.builder().n(String.valueOf(cutoffTimestamp)).build())
                .build();

        ScanEnhancedRequest scanRequest = ScanEnhancedRequest.builder()
                .filterExpression(filterExpression)
                .build();

        return table.scan(scanRequest)
                .items()
                .stream()
                .collect(Collectors.toList());
    }

    @Override
    public void delete(AuditEntry entry) {
        Key key = Key.builder()
                .partitionValue(entry.getTenantId())
                .sortValue(entry.getSequence())
                .build();
        table.deleteItem(key);
    }

    private Key partition(String tenantId) {
        return Key.builder().partitionValue(tenantId).build();
    }
}
