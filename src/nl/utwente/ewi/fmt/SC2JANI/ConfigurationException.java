package nl.utwente.ewi.fmt.SC2JANI;

/** A compile-time constant required by a macro is missing or invalid. */
public class ConfigurationException extends CompilationException {
	private static final long serialVersionUID = 1;
	public ConfigurationException(String msg) { super(msg); }
}
