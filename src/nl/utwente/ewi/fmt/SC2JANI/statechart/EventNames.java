package nl.utwente.ewi.fmt.SC2JANI.statechart;

import java.util.regex.Pattern;

/**
 * Classification of event names generated by the ROS and
 * Behavior-Tree front ends.
 */
public class EventNames
{
	private static final Pattern BT_TICK = Pattern.compile("^bt_.+_tick$");
	private static final Pattern BT_HALT = Pattern.compile("^bt_.+_halt$");
	private static final Pattern BT_RESPONSE = Pattern.compile("^bt_.+_response$");
	private static final Pattern BT_HALT_RESPONSE = Pattern.compile("^bt_.+_halt_response$");
	private static final Pattern ACTION_GOAL = Pattern.compile("^action_.+_goal_.+$");
	private static final Pattern ACTION_RESULT = Pattern.compile("^action_.+_result.*$");
	private static final Pattern ACTION_THREAD = Pattern.compile("^action_.+_thread_(start|free)$");
	private static final Pattern ACTION_FEEDBACK = Pattern.compile("^action_.*_feedback$");
	private static final Pattern ACTION_GOAL_REJECTED = Pattern.compile("^action_.*_goal_rejected$");
	private static final Pattern SERVICE = Pattern.compile("^srv_.+_(response|request|req_client).*$");

	/** Prefix of the automata of Behavior-Tree roots, which get no
	 * self loops. */
	public static final String BT_ROOT_PREFIX = "bt_root_fsm_";

	private EventNames() { }

	/**
	 * Whether the event is part of a request/response protocol
	 * whose participants must wait for it. Receivers of these
	 * events should block rather than ignore them.
	 */
	public static boolean isSynchronized(String event) {
		return isBtEvent(event)
		       || ACTION_GOAL.matcher(event).matches()
		       || ACTION_RESULT.matcher(event).matches()
		       || ACTION_THREAD.matcher(event).matches()
		       || SERVICE.matcher(event).matches();
	}

	public static boolean isBtEvent(String event) {
		return BT_TICK.matcher(event).matches()
		       || BT_HALT.matcher(event).matches()
		       || BT_RESPONSE.matcher(event).matches()
		       || BT_HALT_RESPONSE.matcher(event).matches();
	}

	public static boolean isBtHalt(String event) {
		return BT_HALT.matcher(event).matches();
	}

	/** Events that are dropped when nobody sends them, or always. */
	public static boolean isActionFeedback(String event) {
		return ACTION_FEEDBACK.matcher(event).matches();
	}

	public static boolean isGoalRejected(String event) {
		return ACTION_GOAL_REJECTED.matcher(event).matches();
	}

	public static boolean isBtRoot(String automaton) {
		return automaton.startsWith(BT_ROOT_PREFIX);
	}
}
