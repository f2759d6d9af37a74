package nl.utwente.ewi.fmt.SC2JANI;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import nl.ennoruijters.util.JSONParser;
import nl.utwente.ewi.fmt.SC2JANI.JaniModel.JaniBaseType;
import nl.utwente.ewi.fmt.SC2JANI.JaniModel.JaniConstant;
import nl.utwente.ewi.fmt.SC2JANI.JaniModel.JaniType;
import nl.utwente.ewi.fmt.SC2JANI.expression.ConstantExpression;
import nl.utwente.ewi.fmt.SC2JANI.expression.Expression;
import nl.utwente.ewi.fmt.SC2JANI.statechart.AutomatonBuilder;
import nl.utwente.ewi.fmt.SC2JANI.statechart.EventRegistry;
import nl.utwente.ewi.fmt.SC2JANI.statechart.StateChart;
import nl.utwente.ewi.fmt.SC2JANI.statechart.StateChartReader;

/**
 * The top-level description of a model: its state charts, constants,
 * properties and conversion settings.
 */
public class ModelDescriptor
{
	private static final Logger log = LoggerFactory.getLogger(ModelDescriptor.class);

	public final String name;
	public final String description;
	/** Null if not given. */
	public final Number maxArraySize, randomOptions;
	/** Paths of the state-chart documents, relative to baseDir. */
	public final List<String> statecharts;
	private final List<Map<?, ?>> constants;
	private final List<Map<?, ?>> properties;
	private final File baseDir;

	private ModelDescriptor(Map<?, ?> root, File baseDir, String defaultName)
	{
		Object n = root.get("name");
		if (n != null && !(n instanceof String))
			throw new IllegalArgumentException("Model name should be a string, not: " + n);
		name = n == null ? defaultName : (String)n;
		if (name == null || name.isEmpty())
			throw new IllegalArgumentException("Model without name");
		Object d = root.get("description");
		description = d == null ? "" : d.toString();
		maxArraySize = number(root, "max_array_size");
		randomOptions = number(root, "random_options");
		ArrayList<String> charts = new ArrayList<>();
		for (Object o : array(root, "statecharts")) {
			if (!(o instanceof String))
				throw new IllegalArgumentException("State chart path should be a string, not: " + o);
			charts.add((String)o);
		}
		statecharts = Collections.unmodifiableList(charts);
		constants = objects(root, "constants");
		properties = objects(root, "properties");
		this.baseDir = baseDir;
	}

	public static ModelDescriptor read(String filename) throws IOException {
		File f = new File(filename);
		String base = f.getName();
		if (base.endsWith(".json"))
			base = base.substring(0, base.length() - 5);
		return new ModelDescriptor(map(JSONParser.readJsonFromFile(filename)),
		                           f.getAbsoluteFile().getParentFile(), base);
	}

	/** @param baseDir Directory the state-chart paths are relative
	 * to. */
	public static ModelDescriptor fromJson(Object json, File baseDir) {
		return new ModelDescriptor(map(json), baseDir, null);
	}

	/** Read the state charts and build the model. */
	public JaniModel build(ConversionOptions options) throws IOException {
		ArrayList<StateChart> charts = new ArrayList<>();
		for (String path : statecharts) {
			File f = new File(path);
			if (!f.isAbsolute() && baseDir != null)
				f = new File(baseDir, path);
			log.debug("Reading state chart {}", f);
			charts.add(StateChartReader.read(f.getPath()));
		}
		return build(charts, options);
	}

	public JaniModel build(List<StateChart> charts, ConversionOptions options)
	{
		JaniModel model = new JaniModel(name);
		model.setDescription(description);
		declareConstants(model, options.getConstants());
		int arraySize = options.getMaxArraySize(maxArraySize);
		EventRegistry events = new EventRegistry();
		for (StateChart chart : charts) {
			AutomatonBuilder builder = new AutomatonBuilder(chart, events, arraySize);
			for (JaniConstant c : model.getConstants())
				builder.declareGlobal(c.name, c.type);
			model.addAutomaton(builder.build());
		}
		EventAutomata.implement(events, model);
		RandomAssignmentExpansion.expand(model, options.getRandomOptions(randomOptions));
		for (Map<?, ?> p : properties) {
			try {
				model.addProperty(Property.fromJani(p));
			} catch (UnsupportedOperationException e) {
				log.warn("Skipping property {}: {}", p.get("name"), e.getMessage());
			}
		}
		log.info("Built model {} with {} automata", name, model.getAutomata().size());
		return model;
	}

	private void declareConstants(JaniModel model, Map<String, Object> overrides) {
		for (Map<?, ?> c : constants) {
			Object n = c.get("name");
			if (!(n instanceof String))
				throw new IllegalArgumentException("Constant name should be a string, not: " + n);
			String cname = (String)n;
			Object t = c.get("type");
			JaniBaseType base = t instanceof String ? JaniUtils.parseBaseType((String)t) : null;
			if (base == null)
				throw new IllegalArgumentException("Invalid type " + t + " for constant " + cname);
			Object v = overrides.containsKey(cname) ? overrides.get(cname) : c.get("value");
			if (v == null)
				throw new ConfigurationException("Model parameter '" + cname + "' not specified.");
			Expression value = v instanceof Map ? Expression.fromJani(v)
			                                    : literal(v, base, cname);
			model.addConstant(new JaniConstant(new JaniType(base), cname, value));
		}
		for (String o : overrides.keySet()) {
			if (model.getConstant(o) == null)
				throw new ConfigurationException("Definition of unknown constant " + o);
		}
	}

	private static Expression literal(Object v, JaniBaseType base, String cname) {
		if (base == JaniBaseType.BOOLEAN) {
			if (!(v instanceof Boolean))
				throw new ExpressionTypeException("Boolean constant " + cname + " cannot have value " + v);
			return new ConstantExpression((Boolean)v);
		}
		if (!(v instanceof Number))
			throw new ExpressionTypeException("Numeric constant " + cname + " cannot have value " + v);
		Number num = (Number)v;
		if (base == JaniBaseType.REAL)
			return new ConstantExpression(num.doubleValue());
		try {
			return new ConstantExpression((long)JaniUtils.safeToInteger(num));
		} catch (ArithmeticException e) {
			throw new ExpressionTypeException("Integer constant " + cname + " cannot have value " + v);
		}
	}

	private static Map<?, ?> map(Object json) {
		return map(json, "Model descriptor root");
	}

	private static Map<?, ?> map(Object json, String what) {
		if (!(json instanceof Map))
			throw new IllegalArgumentException(what + " should be an object, not: " + json);
		return (Map<?, ?>)json;
	}

	private static Object[] array(Map<?, ?> root, String key) {
		Object o = root.get(key);
		if (o == null)
			return new Object[0];
		if (!(o instanceof Object[]))
			throw new IllegalArgumentException("'" + key + "' should be an array, not: " + o);
		return (Object[])o;
	}

	private static List<Map<?, ?>> objects(Map<?, ?> root, String key) {
		ArrayList<Map<?, ?>> ret = new ArrayList<>();
		for (Object o : array(root, key))
			ret.add(map(o, "Entry of '" + key + "'"));
		return ret;
	}

	private static Number number(Map<?, ?> root, String key) {
		Object o = root.get(key);
		if (o != null && !(o instanceof Number))
			throw new IllegalArgumentException("'" + key + "' should be a number, not: " + o);
		return (Number)o;
	}
}
