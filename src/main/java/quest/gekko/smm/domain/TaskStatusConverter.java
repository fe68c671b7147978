package quest.gekko.smm.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class TaskStatusConverter implements AttributeConverter<TaskStatus, String> {

    @Override
    public String convertToDatabaseColumn(TaskStatus status) {
        return status == null ? null : status.code();
    }

    @Override
    public TaskStatus convertToEntityAttribute(String code) {
        return code == null ? null : TaskStatus.fromCode(code);
    }
}
