package com.youtubestats;

import java.io.Serializable;
import java.util.Objects;

/**
 * One (source field, source type, destination field, destination type) entry of a mapping table.
 */
public final class FieldMapping implements Serializable {
    
    private static final long serialVersionUID = 1L;
    
    private final String sourceField;
    private final TargetType sourceType;
    private final String destinationField;
    private final TargetType destinationType;
    
    public FieldMapping(String sourceField, TargetType sourceType, String destinationField, TargetType destinationType) {
        this.sourceField = requireName(sourceField, "source");
        this.destinationField = requireName(destinationField, "destination");
        this.sourceType = Objects.requireNonNull(sourceType, "sourceType");
        this.destinationType = Objects.requireNonNull(destinationType, "destinationType");
        // values come off a text file, so nothing but string sources makes sense
        if (sourceType != TargetType.STRING) {
            throw new IllegalArgumentException(
                "Source field '" + sourceField + "' must be of type string, got " + sourceType.getName());
        }
    }
    
    public static FieldMapping of(String sourceField, String sourceType, String destinationField, String destinationType) {
        return new FieldMapping(sourceField, TargetType.fromName(sourceType),
            destinationField, TargetType.fromName(destinationType));
    }
    
    private static String requireName(String name, String role) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Mapping " + role + " field name must not be empty");
        }
        return name.trim();
    }
    
    public String getSourceField() {
        return sourceField;
    }
    
    public TargetType getSourceType() {
        return sourceType;
    }
    
    public String getDestinationField() {
        return destinationField;
    }
    
    public TargetType getDestinationType() {
        return destinationType;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FieldMapping)) {
            return false;
        }
        FieldMapping that = (FieldMapping) o;
        return sourceField.equals(that.sourceField)
            && sourceType == that.sourceType
            && destinationField.equals(that.destinationField)
            && destinationType == that.destinationType;
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(sourceField, sourceType, destinationField, destinationType);
    }
    
    @Override
    public String toString() {
        return "(" + sourceField + ", " + sourceType.getName() + ", "
            + destinationField + ", " + destinationType.getName() + ")";
    }
}
