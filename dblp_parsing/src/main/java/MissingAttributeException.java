public class MissingAttributeException extends Exception {

    private final String attribute;

    public MissingAttributeException(String recordType, String attribute) {
        super(String.format("Record <%s> has no '%s' attribute", recordType, attribute));
        this.attribute = attribute;
    }

    public String getAttribute() {
        return attribute;
    }
}
