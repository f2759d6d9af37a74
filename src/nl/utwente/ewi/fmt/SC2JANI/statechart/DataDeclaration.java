package nl.utwente.ewi.fmt.SC2JANI.statechart;

/** A variable of the datamodel of a state chart. */
public class DataDeclaration
{
	public final String id;
	public final String type;
	/** Initial value, or null for the default of the type. */
	public final String expr;
	/** Optional inclusive bounds. */
	public final Number lower, upper;

	public DataDeclaration(String id, String type, String expr,
	                       Number lower, Number upper)
	{
		if (id == null || id.isEmpty())
			throw new IllegalArgumentException("Data declaration without id");
		if (type == null)
			throw new IllegalArgumentException("Data declaration " + id + " without type");
		this.id = id;
		this.type = type;
		this.expr = expr;
		this.lower = lower;
		this.upper = upper;
	}

	public DataDeclaration(String id, String type, String expr)
	{
		this(id, type, expr, null, null);
	}
}
