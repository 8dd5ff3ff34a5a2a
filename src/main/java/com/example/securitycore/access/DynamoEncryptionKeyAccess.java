package com.example.securitycore.access;

import com.example.securitycore.models.EncryptionKey;
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
public class DynamoEncryptionKeyAccess implements EncryptionKeyAccess {

    public static final String TABLE_NAME = "encryption_keys";

    private final DynamoDbTable<EncryptionKey> table;

    public DynamoEncryptionKeyAccess(DynamoDbEnhancedClient enhancedClient) {
        this.table = enhancedClient.table(TABLE_NAME, TableSchema.fromBean(EncryptionKey.class));
    }

    @Override
    public void create(EncryptionKey key) {
        Expression slotIsFree = Expression.builder()
                .expression("attribute_not_exists(scope_id)")
                .build();
        conditionalPut(key, slotIsFree);
    }

    @Override
    public void update(EncryptionKey key, EncryptionKey.Status expectedStatus) {
        Expression statusUnchanged = Expression.builder()
                .expression("#status = :expected")
                .putExpressionName("#status", "status")
                .putExpressionValue(":expected", AttributeValue.builder().s(expectedStatus.name()).build())
                .build();
        conditionalPut(key, statusUnchanged);
    }

    private void conditionalPut(EncryptionKey key, Expression condition) {
        try {
            table.putItem(PutItemEnhancedRequest.builder(EncryptionKey.class)
                    .item(key)
                    .conditionExpression(condition)
                    .build());
        } catch (ConditionalCheckFailedException ex) {
            throw new KeyVersionConflictException(key.getScopeId(), key.getVersion(), ex);
        }
    }

    @Override
    public List<EncryptionKey> findByScope(String scopeId) {
        return table.query(r -> r.queryConditional(QueryConditional.keyEqualTo(
                                Key.builder().partitionValue(scopeId).build()))
                        .scanIndexForward(true))
                .items()
                .stream()
                .collect(Collectors.toList());
    }

    @Override
    public Optional<EncryptionKey> findByKeyId(String keyId) {
        // Key ids are not part of the primary key; the table is small enough to scan.
        Expression filterExpression = Expression.builder()
                .expression("#kid = :kid")
                .putExpressionName("#kid", "key_id")
                .putExpressionValue(":kid", AttributeValue.builder().s(keyId).build())
                .build();
        return table.scan(ScanEnhancedRequest.builder().filterExpression(filterExpression).build())
                .items()
                .stream()
                .findFirst();
    }

    @Override
    public List<EncryptionKey> findAll() {
        return table.scan()
                .items()
                .stream()
                .collect(Collectors.toList());
    }
}
