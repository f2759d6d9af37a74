package nl.utwente.ewi.fmt.SC2JANI.expression;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import nl.utwente.ewi.fmt.SC2JANI.ConfigurationException;
import nl.utwente.ewi.fmt.SC2JANI.UnsupportedConstructException;

/**
 * Rewrites the macro operators into primitive JANI operators.
 *
 * The geometric macros take the number of vertices of the boundary
 * polygon from the constant {@value #BOUNDARY_COUNT}; the polygon is
 * unrolled into a fixed-depth min/max tree with one term per
 * segment.
 */
public class MacroExpansion
{
	private static final Logger log = LoggerFactory.getLogger(MacroExpansion.class);

	public static final String BOUNDARY_COUNT = "boundaries.count";
	public static final String BARRIER_ALL = "all";
	public static final String BARRIER_BOUNDARIES = "boundaries";
	public static final String BARRIER_OBSTACLES = "obstacles";

	private final Map<String, Expression> constants;
	private int boundaryCount = -1;

	private MacroExpansion(Map<String, Expression> constants) {
		this.constants = constants;
	}

	/**
	 * Expand every macro operator in the expression.
	 *
	 * @param constants The values of the model constants, by name.
	 * @return An expression using only primitive operators. If the
	 * input contains no macros, it is returned unchanged.
	 */
	public static Expression expand(Expression e, Map<String, Expression> constants) {
		if (!e.containsMacro())
			return e;
		return new MacroExpansion(constants).expand(e);
	}

	private Expression expand(Expression e) {
		if (!e.containsMacro())
			return e;
		if (e instanceof OperatorExpression) {
			OperatorExpression oe = (OperatorExpression)e;
			if (oe.op.macro)
				return expand(expandMacro(oe));
		}
		return e.mapChildren(this::expand);
	}

	private Expression expandMacro(OperatorExpression e) {
		switch (e.op) {
		case NORM2D: {
			Expression x = expand(e.getOperand("x"));
			Expression y = expand(e.getOperand("y"));
			return pow(add(mul(x, x), mul(y, y)), real(0.5));
		}
		case DOT2D:
			return add(mul(e.getOperand("x1"), e.getOperand("x2")),
			           mul(e.getOperand("y1"), e.getOperand("y2")));
		case CROSS2D:
			return sub(mul(e.getOperand("x1"), e.getOperand("y2")),
			           mul(e.getOperand("y1"), e.getOperand("x2")));
		case ROUND:
			return new OperatorExpression(Operator.FLOOR,
					add(e.getOperand("exp"), real(0.5)));
		case TO_CM:
			return new OperatorExpression(Operator.ROUND,
					mul(e.getOperand("exp"), real(100.0)));
		case TO_M:
			return mul(e.getOperand("exp"), real(0.01));
		case TO_DEG:
			return new OperatorExpression(Operator.MODULO,
					new OperatorExpression(Operator.ROUND,
						mul(e.getOperand("exp"), real(180.0 / Math.PI))),
					new ConstantExpression(360L));
		case TO_RAD:
			return mul(e.getOperand("exp"), real(Math.PI / 180.0));
		case INTERSECT:
			return intersect(name(e, "robot"), name(e, "barrier"));
		case DISTANCE:
			return distance(name(e, "robot"), name(e, "barrier"));
		case DISTANCE_TO_POINT: {
			String robot = name(e, "robot");
			Expression x = expand(e.getOperand("x"));
			Expression y = expand(e.getOperand("y"));
			Expression dx = sub(var("robots." + robot + ".pose.x_cm"),
			                    new OperatorExpression(Operator.TO_CM, x));
			Expression dy = sub(var("robots." + robot + ".pose.y_cm"),
			                    new OperatorExpression(Operator.TO_CM, y));
			return new OperatorExpression(Operator.TO_M,
					new OperatorExpression(Operator.NORM2D, dx, dy));
		}
		default:
			throw new IllegalArgumentException("Not a macro operator: " + e.op.symbol);
		}
	}

	/* Robot and barrier operands name a part of the model; they are
	 * written as identifiers or as string/integer literals. */
	private static String name(OperatorExpression e, String operand) {
		Expression ret = e.getOperand(operand);
		if (ret instanceof VariableExpression)
			return ((VariableExpression)ret).variable;
		if (ret instanceof ConstantExpression && ((ConstantExpression)ret).isInteger())
			return ((ConstantExpression)ret).value.toString();
		throw new UnsupportedConstructException("Operand '" + operand + "' of " + e.op.symbol + " should be a name, found " + ret);
	}

	private int boundaryCount() {
		if (boundaryCount > 0)
			return boundaryCount;
		Expression c = constants.get(BOUNDARY_COUNT);
		if (c == null)
			throw new ConfigurationException("Geometric macros need the constant " + BOUNDARY_COUNT);
		if (!(c instanceof ConstantExpression) || !((ConstantExpression)c).isInteger())
			throw new ConfigurationException("Constant " + BOUNDARY_COUNT + " should be an integer, found " + c);
		long n = (Long)((ConstantExpression)c).value;
		if (n <= 1)
			throw new ConfigurationException("Constant " + BOUNDARY_COUNT + " should be at least 2, found " + n);
		boundaryCount = (int)n;
		log.debug("Unrolling geometric macros over {} boundary segments", boundaryCount);
		return boundaryCount;
	}

	/** A segment from vertex i to the next one, with the probe
	 * vectors relative to its end points. */
	private class Segment
	{
		final Expression abX, abY, baX, baY, norm;
		final Expression ax, ay, bx, by;

		Segment(int i) {
			int n = boundaryCount();
			ax = var("boundaries." + i + ".x");
			ay = var("boundaries." + i + ".y");
			bx = var("boundaries." + ((i + 1) % n) + ".x");
			by = var("boundaries." + ((i + 1) % n) + ".y");
			abX = sub(bx, ax);
			abY = sub(by, ay);
			baX = sub(ax, bx);
			baY = sub(ay, by);
			norm = new OperatorExpression(Operator.NORM2D, abX, abY);
		}
	}

	private Expression intersect(String robot, String barrier) {
		int n = boundaryCount();
		Expression boundaries = intersectFrom(robot, 0, n);
		// TODO: model obstacle geometry; obstacles never block a path yet.
		Expression obstacles = real(0.0);
		switch (barrier) {
		case BARRIER_ALL:
			return max(boundaries, obstacles);
		case BARRIER_BOUNDARIES:
			return boundaries;
		case BARRIER_OBSTACLES:
			return obstacles;
		default:
			throw new UnsupportedConstructException("Unknown barrier '" + barrier + "'");
		}
	}

	private Expression intersectFrom(String robot, int i, int n) {
		if (i >= n)
			return real(0.0);
		return max(intersectSegment(robot, i), intersectFrom(robot, i + 1, n));
	}

	/* Fraction of the path from goal to pose at which the robot
	 * first touches segment i, or 0.0 if it stays clear. */
	private Expression intersectSegment(String robot, int i) {
		Segment s = new Segment(i);
		String r = "robots." + robot;
		Expression rad = var(r + ".shape.radius");
		Expression ex = var(r + ".goal.x"), ey = var(r + ".goal.y");
		Expression sx = var(r + ".pose.x"), sy = var(r + ".pose.y");
		Expression eaX = sub(s.ax, ex), eaY = sub(s.ay, ey);
		Expression ebX = sub(s.bx, ex), ebY = sub(s.by, ey);
		Expression esX = sub(sx, ex), esY = sub(sy, ey);

		Expression crossEa = cross(s.abX, s.abY, eaX, eaY);
		Expression crossEs = cross(s.abX, s.abY, esX, esY);
		Expression dotA = dot(s.abX, s.abY, eaX, eaY);
		Expression dotB = dot(s.baX, s.baY, ebX, ebY);
		Expression vDist = div(abs(crossEa), s.norm);
		Expression haDist = div(dotA, s.norm);
		Expression hbDist = div(dotB, s.norm);
		Expression isPerp = eq(dot(s.abX, s.abY, esX, esY), real(0.0));
		Expression isPar = eq(crossEs, real(0.0));
		Expression normRad = mul(s.norm, rad);

		Expression haInterp = ite(
				and(ge(haDist, real(0.0)), lt(haDist, rad)),
				div(sub(normRad, dotA), dot(s.baX, s.baY, esX, esY)),
				real(1.0));
		Expression hbInterp = ite(
				and(ge(hbDist, real(0.0)), lt(hbDist, rad)),
				div(sub(normRad, dotB), dot(s.abX, s.abY, esX, esY)),
				real(1.0));
		Expression hInterp = ite(isPerp, real(1.0), min(haInterp, hbInterp));
		Expression vInterp = ite(
				new OperatorExpression(Operator.OR, isPar, ge(vDist, rad)),
				real(1.0),
				div(sub(normRad, abs(crossEa)), abs(crossEs)));
		return ite(ge(max(vDist, max(haDist, hbDist)), rad),
				real(0.0),
				min(hInterp, vInterp));
	}

	private Expression distance(String robot, String barrier) {
		int n = boundaryCount();
		Expression boundaries = distanceFrom(robot, 0, n);
		// TODO: model obstacle geometry; the obstacle term is a placeholder.
		Expression obstacles = ConstantExpression.TRUE;
		switch (barrier) {
		case BARRIER_ALL:
			return min(boundaries, obstacles);
		case BARRIER_BOUNDARIES:
			return boundaries;
		case BARRIER_OBSTACLES:
			return obstacles;
		default:
			throw new UnsupportedConstructException("Unknown barrier '" + barrier + "'");
		}
	}

	private Expression distanceFrom(String robot, int i, int n) {
		if (i >= n)
			return ConstantExpression.TRUE;
		return min(distanceSegment(robot, i), distanceFrom(robot, i + 1, n));
	}

	/* Clearance between the robot outline and segment i. */
	private Expression distanceSegment(String robot, int i) {
		Segment s = new Segment(i);
		String r = "robots." + robot;
		Expression rad = var(r + ".shape.radius");
		Expression px = var(r + ".pose.x"), py = var(r + ".pose.y");
		Expression raX = sub(s.ax, px), raY = sub(s.ay, py);
		Expression rbX = sub(s.bx, px), rbY = sub(s.by, py);
		Expression vDist = div(abs(cross(s.abX, s.abY, raX, raY)), s.norm);
		Expression ha = div(dot(s.abX, s.abY, raX, raY), s.norm);
		Expression hb = div(dot(s.baX, s.baY, rbX, rbY), s.norm);
		Expression hDist = max(max(ha, hb), real(0.0));
		return sub(new OperatorExpression(Operator.NORM2D, hDist, vDist), rad);
	}

	private static Expression var(String name) {
		return new VariableExpression(name);
	}

	private static Expression real(double v) {
		return new ConstantExpression(v);
	}

	private static Expression add(Expression l, Expression r) {
		return new OperatorExpression(Operator.ADD, l, r);
	}

	private static Expression sub(Expression l, Expression r) {
		return new OperatorExpression(Operator.SUBTRACT, l, r);
	}

	private static Expression mul(Expression l, Expression r) {
		return new OperatorExpression(Operator.MULTIPLY, l, r);
	}

	private static Expression div(Expression l, Expression r) {
		return new OperatorExpression(Operator.DIVIDE, l, r);
	}

	private static Expression pow(Expression l, Expression r) {
		return new OperatorExpression(Operator.POW, l, r);
	}

	private static Expression min(Expression l, Expression r) {
		return new OperatorExpression(Operator.MIN, l, r);
	}

	private static Expression max(Expression l, Expression r) {
		return new OperatorExpression(Operator.MAX, l, r);
	}

	private static Expression abs(Expression e) {
		return new OperatorExpression(Operator.ABS, e);
	}

	private static Expression eq(Expression l, Expression r) {
		return new OperatorExpression(Operator.EQUALS, l, r);
	}

	private static Expression ge(Expression l, Expression r) {
		return new OperatorExpression(Operator.GREATER_OR_EQUAL, l, r);
	}

	private static Expression lt(Expression l, Expression r) {
		return new OperatorExpression(Operator.LESS, l, r);
	}

	private static Expression and(Expression l, Expression r) {
		return new OperatorExpression(Operator.AND, l, r);
	}

	private static Expression ite(Expression c, Expression t, Expression e) {
		return new OperatorExpression(Operator.ITE, c, t, e);
	}

	private static Expression dot(Expression x1, Expression y1, Expression x2, Expression y2) {
		return new OperatorExpression(Operator.DOT2D, x1, y1, x2, y2);
	}

	private static Expression cross(Expression x1, Expression y1, Expression x2, Expression y2) {
		return new OperatorExpression(Operator.CROSS2D, x1, y1, x2, y2);
	}
}
