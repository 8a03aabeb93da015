// File: src/main/java/org/lokray/checker/environment/TermPrinter.java
package org.lokray.checker.environment;

import org.lokray.checker.environment.decl.Constructor;
import org.lokray.checker.environment.decl.Declaration;
import org.lokray.checker.environment.decl.Definition;
import org.lokray.checker.environment.decl.Inductive;
import org.lokray.checker.environment.term.*;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders entries of an {@link Environment} in a Lean-like surface syntax.
 * <p>
 * Bound variables are resolved against an explicit stack of the binder names
 * currently in scope, innermost last. A bound variable that points past the
 * outermost binder is printed as {@code <i>} instead of failing, so partially
 * bound or ill-formed terms can still be inspected.
 */
public class TermPrinter
{
	public static final String UNBOUND_FORMAT = "<%d>";

	private final Environment env;
	private final boolean showBinderStack;

	public TermPrinter(Environment env, boolean showBinderStack)
	{
		this.env = env;
		this.showBinderStack = showBinderStack;
	}

	public String renderName(int index)
	{
		List<String> segments = new ArrayList<>();
		Name name = env.getName(index);
		segments.add(name.getSegment());
		while (name.getParent().isPresent())
		{
			name = env.getName(name.getParent().get());
			segments.add(name.getSegment());
		}
		StringBuilder sb = new StringBuilder();
		for (int i = segments.size() - 1; i >= 0; i--)
		{
			sb.append(segments.get(i));
			if (i > 0)
			{
				sb.append('.');
			}
		}
		return sb.toString();
	}

	public String renderLevel(int index)
	{
		StringBuilder out = new StringBuilder();
		run(new LevelStep(index), out, new ArrayList<>());
		return out.toString();
	}

	/**
	 * Renders a closed expression, starting from an empty binder stack.
	 */
	public String renderExpr(int index)
	{
		List<String> binders = new ArrayList<>();
		String result = renderExpr(index, binders);
		if (!binders.isEmpty())
		{
			throw new IllegalStateException("Binder stack not balanced after rendering expression " + index);
		}
		return result;
	}

	/**
	 * Renders an expression under the given binders. The list is used as a
	 * stack and is restored to its original contents before returning.
	 * <p>
	 * Terms are walked with an explicit work stack, so the nesting depth of a
	 * term is bounded by the heap and not by the thread stack.
	 */
	public String renderExpr(int index, List<String> binders)
	{
		int depth = binders.size();
		StringBuilder out = new StringBuilder();
		try
		{
			run(new ExprStep(index), out, binders);
		}
		finally
		{
			binders.subList(depth, binders.size()).clear();
		}
		return out.toString();
	}

	// Work items: a String is emitted as is, the records expand into more work.
	private record ExprStep(int index)
	{
	}

	private record LevelStep(int index)
	{
	}

	private record PushBinder(String name)
	{
	}

	private enum Marker
	{
		POP_BINDER,
		BINDER_STACK
	}

	private void run(Object first, StringBuilder out, List<String> binders)
	{
		Deque<Object> work = new ArrayDeque<>();
		work.push(first);
		while (!work.isEmpty())
		{
			Object step = work.pop();
			if (step instanceof String text)
			{
				out.append(text);
			}
			else if (step instanceof ExprStep expr)
			{
				expandExpr(expr.index(), work, out, binders);
			}
			else if (step instanceof LevelStep level)
			{
				expandLevel(level.index(), work, out);
			}
			else if (step instanceof PushBinder push)
			{
				binders.add(push.name());
			}
			else if (step == Marker.POP_BINDER)
			{
				binders.remove(binders.size() - 1);
			}
			else if (step == Marker.BINDER_STACK)
			{
				out.append(" [").append(String.join(",", binders)).append(']');
			}
		}
	}

	// Pushes the steps so that they run in the order given.
	private static void schedule(Deque<Object> work, Object... steps)
	{
		for (int i = steps.length - 1; i >= 0; i--)
		{
			work.push(steps[i]);
		}
	}

	private void expandLevel(int index, Deque<Object> work, StringBuilder out)
	{
		Level level = env.getLevel(index);
		if (level instanceof ZeroLevel)
		{
			out.append('0');
		}
		else if (level instanceof SuccLevel succ)
		{
			schedule(work, "(succ ", new LevelStep(succ.getLevel()), ")");
		}
		else if (level instanceof MaxLevel max)
		{
			schedule(work, "(max ", new LevelStep(max.getLhs()), " ", new LevelStep(max.getRhs()), ")");
		}
		else if (level instanceof IMaxLevel imax)
		{
			schedule(work, "(imax ", new LevelStep(imax.getLhs()), " ", new LevelStep(imax.getRhs()), ")");
		}
		else if (level instanceof ParamLevel param)
		{
			out.append(renderName(param.getName()));
		}
		else
		{
			throw new IllegalStateException("Unknown level kind: " + level.getClass().getSimpleName());
		}
	}

	private void expandExpr(int index, Deque<Object> work, StringBuilder out, List<String> binders)
	{
		Expr expr = env.getExpr(index);
		if (expr instanceof SortExpr sort)
		{
			schedule(work, "Sort ", new LevelStep(sort.getLevel()));
		}
		else if (expr instanceof BoundVarExpr var)
		{
			out.append(resolveBoundVar(var.getIndex(), binders));
		}
		else if (expr instanceof ConstantExpr constant)
		{
			out.append(renderName(constant.getName()));
			List<Integer> levels = constant.getLevels();
			if (!levels.isEmpty())
			{
				List<Object> steps = new ArrayList<>();
				steps.add(".{");
				for (int i = 0; i < levels.size(); i++)
				{
					if (i > 0)
					{
						steps.add(",");
					}
					steps.add(new LevelStep(levels.get(i)));
				}
				steps.add("}");
				schedule(work, steps.toArray());
			}
		}
		else if (expr instanceof ApplicationExpr app)
		{
			schedule(work, "(", new ExprStep(app.getFunction()), " ", new ExprStep(app.getArgument()), ")");
		}
		else if (expr instanceof BinderExpr binder)
		{
			// The domain is printed before the binder's own name is in scope.
			BinderInfo info = binder.getInfo();
			String varName = renderName(binder.getName());
			schedule(work,
					info.getOpen() + varName + " : ",
					new ExprStep(binder.getDomain()),
					info.getClose() + ", ",
					new PushBinder(varName),
					new ExprStep(binder.getBody()),
					Marker.POP_BINDER,
					showBinderStack ? Marker.BINDER_STACK : "");
		}
		else
		{
			throw new IllegalStateException("Unknown expression kind: " + expr.getClass().getSimpleName());
		}
	}

	private String resolveBoundVar(int deBruijnIndex, List<String> binders)
	{
		if (deBruijnIndex < binders.size())
		{
			return binders.get(binders.size() - 1 - deBruijnIndex);
		}
		return String.format(UNBOUND_FORMAT, deBruijnIndex);
	}

	public String renderDeclaration(int nameIndex)
	{
		Declaration declaration = env.getDeclaration(nameIndex);
		String name = renderName(nameIndex);
		if (declaration instanceof Definition def)
		{
			String params = def.getLevelParams().isEmpty() ? "" : ".{" + renderNames(def.getLevelParams()) + "}";
			return "definition " + name + params + " " + renderExpr(def.getType()) + " := " + renderExpr(def.getValue());
		}
		if (declaration instanceof Inductive ind)
		{
			StringBuilder sb = new StringBuilder("inductive ").append(name);
			if (!ind.getLevelParams().isEmpty())
			{
				sb.append(" {").append(renderNames(ind.getLevelParams())).append('}');
			}
			sb.append(' ').append(renderExpr(ind.getType()));
			for (Constructor constructor : ind.getConstructors())
			{
				sb.append("\n| ")
						.append(renderName(constructor.name()))
						.append(" : ")
						.append(renderExpr(constructor.type()));
			}
			return sb.toString();
		}
		throw new IllegalStateException("Unknown declaration kind: " + declaration.getClass().getSimpleName());
	}

	private String renderNames(List<Integer> names)
	{
		return names.stream().map(this::renderName).collect(Collectors.joining(","));
	}
}
