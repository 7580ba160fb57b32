package io.b2mash.ledgerbooks.audit;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class AuditActionConverter implements AttributeConverter<AuditAction, String> {

  @Override
  public String convertToDatabaseColumn(AuditAction action) {
    return action != null ? action.value() : null;
  }

  @Override
  public AuditAction convertToEntityAttribute(String value) {
    return value != null ? AuditAction.fromValue(value) : null;
  }
}
