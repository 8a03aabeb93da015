// File: src/main/java/org/lokray/checker/environment/Environment.java
package org.lokray.checker.environment;

import org.lokray.checker.environment.decl.Constructor;
import org.lokray.checker.environment.decl.Declaration;
import org.lokray.checker.environment.decl.Definition;
import org.lokray.checker.environment.decl.Inductive;
import org.lokray.checker.environment.term.*;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Index addressed store of everything read from an export file.
 * <p>
 * Names, levels and expressions each live in their own table, keyed by the
 * index the export file assigned to them. Declarations are keyed by the index
 * of the name they declare. Entries are written once and never change; every
 * reference an entry carries must already be present when it is added, so
 * the tables can only ever describe an acyclic graph.
 * <p>
 * Index 0 is reserved: it is never a name or expression, and in the level
 * table it always holds {@link ZeroLevel}.
 */
public class Environment
{
	public static final int RESERVED_INDEX = 0;

	private final Map<Integer, Name> names = new HashMap<>();
	private final Map<Integer, Level> levels = new HashMap<>();
	private final Map<Integer, Expr> exprs = new HashMap<>();
	private final Map<Integer, Declaration> declarations = new LinkedHashMap<>();
	private final List<EnvironmentListener> listeners = new ArrayList<>();
	private final TermPrinter printer;

	public Environment()
	{
		this(false);
	}

	/**
	 * @param showBinderStack append the names in scope to every printed binder, for debugging.
	 */
	public Environment(boolean showBinderStack)
	{
		levels.put(RESERVED_INDEX, ZeroLevel.INSTANCE);
		this.printer = new TermPrinter(this, showBinderStack);
	}

	public void addListener(EnvironmentListener listener)
	{
		listeners.add(listener);
	}

	// --- Names ---

	public Name addStringName(int index, String segment, Optional<Integer> parent) throws IntegrityException
	{
		checkNewName(index, parent);
		return putName(index, new StringName(segment, parent));
	}

	public Name addNumericName(int index, long value, Optional<Integer> parent) throws IntegrityException
	{
		checkNewName(index, parent);
		return putName(index, new NumericName(value, parent));
	}

	private void checkNewName(int index, Optional<Integer> parent) throws IntegrityException
	{
		checkFree("Name", names, index);
		if (parent.isPresent())
		{
			requireName(parent.get());
		}
	}

	private Name putName(int index, Name name)
	{
		names.put(index, name);
		listeners.forEach(l -> l.nameAdded(this, index, name));
		return name;
	}

	// --- Levels ---

	public Level addLevelSucc(int index, int level) throws IntegrityException
	{
		checkFree("Level", levels, index);
		requireLevel(level);
		return putLevel(index, new SuccLevel(level));
	}

	public Level addLevelMax(int index, int lhs, int rhs) throws IntegrityException
	{
		checkFree("Level", levels, index);
		requireLevel(lhs);
		requireLevel(rhs);
		return putLevel(index, new MaxLevel(lhs, rhs));
	}

	public Level addLevelIMax(int index, int lhs, int rhs) throws IntegrityException
	{
		checkFree("Level", levels, index);
		requireLevel(lhs);
		requireLevel(rhs);
		return putLevel(index, new IMaxLevel(lhs, rhs));
	}

	public Level addLevelParam(int index, int name) throws IntegrityException
	{
		checkFree("Level", levels, index);
		requireName(name);
		return putLevel(index, new ParamLevel(name));
	}

	private Level putLevel(int index, Level level)
	{
		levels.put(index, level);
		listeners.forEach(l -> l.levelAdded(this, index, level));
		return level;
	}

	// --- Expressions ---

	public Expr addExprBoundVar(int index, int deBruijnIndex) throws IntegrityException
	{
		checkFree("Expression", exprs, index);
		return putExpr(index, new BoundVarExpr(deBruijnIndex));
	}

	public Expr addExprSort(int index, int level) throws IntegrityException
	{
		checkFree("Expression", exprs, index);
		requireLevel(level);
		return putExpr(index, new SortExpr(level));
	}

	public Expr addExprConstant(int index, int name, List<Integer> levelArgs) throws IntegrityException
	{
		checkFree("Expression", exprs, index);
		requireName(name);
		for (int level : levelArgs)
		{
			requireLevel(level);
		}
		return putExpr(index, new ConstantExpr(name, levelArgs));
	}

	public Expr addExprApplication(int index, int function, int argument) throws IntegrityException
	{
		checkFree("Expression", exprs, index);
		requireExpr(function);
		requireExpr(argument);
		return putExpr(index, new ApplicationExpr(function, argument));
	}

	public Expr addExprLambda(int index, BinderInfo info, int name, int domain, int body) throws IntegrityException
	{
		checkBinder(index, name, domain, body);
		return putExpr(index, new LambdaExpr(info, name, domain, body));
	}

	public Expr addExprPi(int index, BinderInfo info, int name, int domain, int codomain) throws IntegrityException
	{
		checkBinder(index, name, domain, codomain);
		return putExpr(index, new PiExpr(info, name, domain, codomain));
	}

	private void checkBinder(int index, int name, int domain, int body) throws IntegrityException
	{
		checkFree("Expression", exprs, index);
		requireName(name);
		requireExpr(domain);
		requireExpr(body);
	}

	private Expr putExpr(int index, Expr expr)
	{
		exprs.put(index, expr);
		listeners.forEach(l -> l.exprAdded(this, index, expr));
		return expr;
	}

	// --- Declarations ---

	public Declaration addDefinition(int name, int type, int value, List<Integer> levelParams) throws IntegrityException
	{
		checkNewDeclaration(name, type, levelParams);
		requireExpr(value);
		return putDeclaration(name, new Definition(type, value, levelParams));
	}

	public Declaration addInductive(int numParams, int name, int type, List<Constructor> constructors, List<Integer> levelParams) throws IntegrityException
	{
		checkNewDeclaration(name, type, levelParams);
		for (Constructor constructor : constructors)
		{
			requireName(constructor.name());
			requireExpr(constructor.type());
		}
		return putDeclaration(name, new Inductive(numParams, type, constructors, levelParams));
	}

	private void checkNewDeclaration(int name, int type, List<Integer> levelParams) throws IntegrityException
	{
		requireName(name);
		if (declarations.containsKey(name))
		{
			throw new IntegrityException("Declaration of '" + renderName(name) + "' already exists");
		}
		requireExpr(type);
		for (int param : levelParams)
		{
			requireName(param);
		}
	}

	private Declaration putDeclaration(int name, Declaration declaration)
	{
		declarations.put(name, declaration);
		listeners.forEach(l -> l.declarationAdded(this, name, declaration));
		return declaration;
	}

	// --- Integrity checks ---

	private static void checkFree(String table, Map<Integer, ?> entries, int index) throws IntegrityException
	{
		if (entries.containsKey(index))
		{
			throw new IntegrityException(table + " index " + index + " is already defined");
		}
		if (index == RESERVED_INDEX)
		{
			throw new IntegrityException(table + " index " + RESERVED_INDEX + " is reserved");
		}
	}

	private void requireName(int index) throws IntegrityException
	{
		if (!names.containsKey(index))
		{
			throw new IntegrityException("Reference to undefined name " + index);
		}
	}

	private void requireLevel(int index) throws IntegrityException
	{
		if (!levels.containsKey(index))
		{
			throw new IntegrityException("Reference to undefined level " + index);
		}
	}

	private void requireExpr(int index) throws IntegrityException
	{
		if (!exprs.containsKey(index))
		{
			throw new IntegrityException("Reference to undefined expression " + index);
		}
	}

	// --- Lookups ---

	public Optional<Name> lookupName(int index)
	{
		return Optional.ofNullable(names.get(index));
	}

	public Optional<Level> lookupLevel(int index)
	{
		return Optional.ofNullable(levels.get(index));
	}

	public Optional<Expr> lookupExpr(int index)
	{
		return Optional.ofNullable(exprs.get(index));
	}

	public Optional<Declaration> lookupDeclaration(int nameIndex)
	{
		return Optional.ofNullable(declarations.get(nameIndex));
	}

	public Name getName(int index)
	{
		return lookupName(index).orElseThrow(() -> new NotFoundException("Name", index));
	}

	public Level getLevel(int index)
	{
		return lookupLevel(index).orElseThrow(() -> new NotFoundException("Level", index));
	}

	public Expr getExpr(int index)
	{
		return lookupExpr(index).orElseThrow(() -> new NotFoundException("Expression", index));
	}

	public Declaration getDeclaration(int nameIndex)
	{
		return lookupDeclaration(nameIndex).orElseThrow(() -> new NotFoundException("Declaration", nameIndex));
	}

	/**
	 * @return the name indices of all declarations, in the order they were added.
	 */
	public List<Integer> getDeclarationNames()
	{
		return List.copyOf(declarations.keySet());
	}

	public int nameCount()
	{
		return names.size();
	}

	/**
	 * @return the number of levels, including the implicit zero level.
	 */
	public int levelCount()
	{
		return levels.size();
	}

	public int exprCount()
	{
		return exprs.size();
	}

	public int declarationCount()
	{
		return declarations.size();
	}

	// --- Rendering ---

	public String renderName(int index)
	{
		return printer.renderName(index);
	}

	public String renderLevel(int index)
	{
		return printer.renderLevel(index);
	}

	public String renderExpr(int index)
	{
		return printer.renderExpr(index);
	}

	public String renderDeclaration(int nameIndex)
	{
		return printer.renderDeclaration(nameIndex);
	}
}
