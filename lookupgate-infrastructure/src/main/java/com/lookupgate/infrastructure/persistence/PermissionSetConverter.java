package com.lookupgate.infrastructure.persistence;

import com.lookupgate.domain.model.Permission;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Stores a permission set as a sorted, comma-separated list of wire values.
 */
@Converter
public class PermissionSetConverter implements AttributeConverter<Set<Permission>, String> {

  private static final Logger log = LoggerFactory.getLogger(PermissionSetConverter.class);

  @Override
  public String convertToDatabaseColumn(Set<Permission> permissions) {
    if (permissions == null || permissions.isEmpty()) return "";
    return permissions.stream()
        .map(Permission::value)
        .sorted(Comparator.naturalOrder())
        .collect(Collectors.joining(","));
  }

  @Override
  public Set<Permission> convertToEntityAttribute(String column) {
    Set<Permission> out = EnumSet.noneOf(Permission.class);
    if (column == null || column.isBlank()) return out;
    for (String raw : column.split(",")) {
      Optional<Permission> p = Permission.fromValue(raw);
      if (p.isPresent()) {
        out.add(p.get());
      } else {
        log.warn("Dropping unknown stored permission value={}", raw);
      }
    }
    return out;
  }
}
