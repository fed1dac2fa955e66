package net.bibrecords.exception;

/**
 * No citation style is registered under the requested name.
 */
public class UnknownCitationStyleException extends IllegalArgumentException {

    private final String styleName;

    public UnknownCitationStyleException(String styleName) {
        super("No citation style registered under '" + styleName + "'");
        this.styleName = styleName;
    }

    public String getStyleName() {
        return styleName;
    }
}
