package com.txledger.infrastructure.config;

import com.txledger.domain.model.Amount;
import com.txledger.domain.model.TransactionRecord;
import com.txledger.domain.model.TransactionType;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.eventbus.EventBus;
import io.vertx.core.eventbus.MessageCodec;
import io.vertx.core.json.JsonObject;

/**
 * Message codec for TransactionRecord to enable event bus transmission
 */
public class TransactionRecordCodec implements MessageCodec<TransactionRecord, TransactionRecord> {

    /**
     * Register as default codec for TransactionRecord, replacing any earlier registration
     */
    public static void register(EventBus eventBus) {
        eventBus.unregisterDefaultCodec(TransactionRecord.class);
        eventBus.registerDefaultCodec(TransactionRecord.class, new TransactionRecordCodec());
    }

    @Override
    public void encodeToWire(Buffer buffer, TransactionRecord record) {
        JsonObject json = new JsonObject()
                .put("type", record.getType().getValue())
                .put("client", record.getClientId())
                .put("tx", record.getTxId());
        if (record.hasAmount()) {
            json.put("amount", record.getAmount().scaledValue());
        }

        Buffer encoded = json.toBuffer();
        buffer.appendInt(encoded.length());
        buffer.appendBuffer(encoded);
    }

    @Override
    public TransactionRecord decodeFromWire(int position, Buffer buffer) {
        int length = buffer.getInt(position);
        int offset = position + 4;
        JsonObject json = new JsonObject(buffer.getBuffer(offset, offset + length));

        Long scaled = json.getLong("amount");
        return TransactionRecord.of(
                TransactionType.fromValue(json.getString("type")),
                json.getInteger("client"),
                json.getLong("tx"),
                scaled != null ? Amount.ofScaled(scaled) : null
        );
    }

    @Override
    public TransactionRecord transform(TransactionRecord record) {
        // Immutable - safe to hand the same instance to the local consumer
        return record;
    }

    @Override
    public String name() {
        return "TransactionRecordCodec";
    }

    @Override
    public byte systemCodecID() {
        return -1; // -1 indicates custom codec
    }
}
