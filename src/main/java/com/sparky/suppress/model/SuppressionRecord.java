package com.sparky.suppress.model;

import com.sparky.suppress.Const;
import io.vertx.core.json.JsonObject;

/**
 * One suppression list entry. Only recipient is mandatory; the passthrough fields
 * (source, created, updated, subaccountId) are never sent on upsert.
 */
public record SuppressionRecord(
    String recipient,
    SuppressionType type,
    String description,
    String source,
    String created,
    String updated,
    String subaccountId
) {
    public static SuppressionRecord of(String recipient, SuppressionType type) {
        return new SuppressionRecord(recipient, type, null, null, null, null, null);
    }

    public IdentityKey identityKey() {
        return new IdentityKey(recipient, type);
    }

    /**
     * Upsert representation: recipient, type and description, absent fields omitted.
     */
    public JsonObject toJson() {
        JsonObject json = new JsonObject().put(Const.Field.Recipient, recipient);
        if (type != null) {
            json.put(Const.Field.Type, type.wireName());
        }
        if (description != null) {
            json.put(Const.Field.Description, description);
        }
        return json;
    }
}
