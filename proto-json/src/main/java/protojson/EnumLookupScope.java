package protojson;

/**
 * Where a symbolic enum name found in JSON input is looked up.
 *
 * @author Freeman
 */
public enum EnumLookupScope {
    /**
     * Search every enum type declared directly on the message type being decoded, in declaration order,
     * and take the number of the first symbol with that name. A field whose enum type is declared
     * elsewhere (top level, or on another message) cannot be decoded by name in this scope.
     */
    MESSAGE_TYPE,
    /**
     * Search only the field's own enum type.
     */
    FIELD_TYPE
}
