package quest.gekko.smm.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class SnapshotStatusConverter implements AttributeConverter<SnapshotStatus, String> {

    @Override
    public String convertToDatabaseColumn(SnapshotStatus status) {
        return status == null ? null : status.code();
    }

    @Override
    public SnapshotStatus convertToEntityAttribute(String code) {
        return code == null ? null : SnapshotStatus.fromCode(code);
    }
}
