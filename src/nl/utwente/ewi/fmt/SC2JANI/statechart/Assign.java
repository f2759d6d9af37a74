package nl.utwente.ewi.fmt.SC2JANI.statechart;

/** Assignment of an expression to a variable or array element. */
public class Assign extends ExecutableEntry
{
	public final String location;
	public final String expr;

	public Assign(String location, String expr)
	{
		if (location == null || location.isEmpty())
			throw new IllegalArgumentException("Assignment without location");
		if (expr == null)
			throw new IllegalArgumentException("Assignment to " + location + " without expression");
		this.location = location;
		this.expr = expr;
	}

	public Kind getKind() {
		return Kind.ASSIGN;
	}

	public String toString() {
		return location + " = " + expr;
	}
}
