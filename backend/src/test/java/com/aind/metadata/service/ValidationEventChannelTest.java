package com.aind.metadata.service;

import com.aind.metadata.model.RecordType;
import com.aind.metadata.model.ValidationResult;
import com.aind.metadata.model.ValidationStatus;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ValidationEventChannelTest {

    private static ValidationResult result(RecordType type) {
        return ValidationResult.builder().recordType(type).status(ValidationStatus.VALID).build();
    }

    @Test
    void deliversInPublishOrder() {
        ValidationEventChannel channel = new ValidationEventChannel();
        channel.publish(result(RecordType.SUBJECT));
        channel.publish(result(RecordType.SESSION));

        assertThat(channel.size()).isEqualTo(2);
        assertThat(channel.poll().getRecordType()).isEqualTo(RecordType.SUBJECT);
        assertThat(channel.poll().getRecordType()).isEqualTo(RecordType.SESSION);
        assertThat(channel.poll()).isNull();
        assertThat(channel.isEmpty()).isTrue();
    }

    @Test
    void fullChannelDropsInsteadOfBlocking() {
        ValidationEventChannel channel = new ValidationEventChannel(1);

        assertThat(channel.publish(result(RecordType.SUBJECT))).isTrue();
        assertThat(channel.publish(result(RecordType.RIG))).isFalse();

        assertThat(channel.poll().getRecordType()).isEqualTo(RecordType.SUBJECT);
        assertThat(channel.poll()).isNull();
    }
}
