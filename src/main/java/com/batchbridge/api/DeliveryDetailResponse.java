package com.batchbridge.api;

import com.batchbridge.infrastructure.persistence.entity.WebhookDeliveryAttemptEntity;
import com.batchbridge.infrastructure.persistence.entity.WebhookDeliveryEntity;
import lombok.Value;

import java.util.List;

@Value
public class DeliveryDetailResponse {
    WebhookDeliveryEntity delivery;
    List<WebhookDeliveryAttemptEntity> attempts;
}
