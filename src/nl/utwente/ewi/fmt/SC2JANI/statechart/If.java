package nl.utwente.ewi.fmt.SC2JANI.statechart;

import java.util.List;

/**
 * Conditional execution: the body of the first branch whose
 * condition holds is executed, otherwise the else body.
 */
public class If extends ExecutableEntry
{
	public static class Branch {
		public final String cond;
		public final List<ExecutableEntry> body;

		public Branch(String cond, List<ExecutableEntry> body) {
			if (cond == null)
				throw new IllegalArgumentException("Conditional branch without condition");
			this.cond = cond;
			this.body = List.copyOf(body);
		}
	}

	public final List<Branch> branches;
	/** Empty if there is no else branch. */
	public final List<ExecutableEntry> elseBody;

	public If(List<Branch> branches, List<ExecutableEntry> elseBody)
	{
		if (branches.isEmpty())
			throw new IllegalArgumentException("Conditional without branches");
		this.branches = List.copyOf(branches);
		this.elseBody = elseBody == null ? List.of() : List.copyOf(elseBody);
	}

	public Kind getKind() {
		return Kind.IF;
	}

	public String toString() {
		return "if " + branches.get(0).cond;
	}
}
