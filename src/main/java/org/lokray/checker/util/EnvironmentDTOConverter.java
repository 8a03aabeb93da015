// File: src/main/java/org/lokray/checker/util/EnvironmentDTOConverter.java
package org.lokray.checker.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.lokray.checker.dto.ConstructorDTO;
import org.lokray.checker.dto.DeclarationDTO;
import org.lokray.checker.dto.EnvironmentDTO;
import org.lokray.checker.environment.Environment;
import org.lokray.checker.environment.decl.Constructor;
import org.lokray.checker.environment.decl.Declaration;
import org.lokray.checker.environment.decl.Definition;
import org.lokray.checker.environment.decl.Inductive;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;

public class EnvironmentDTOConverter
{
	public static EnvironmentDTO toDTO(Environment env, String source)
	{
		EnvironmentDTO dto = new EnvironmentDTO();
		dto.source = source;
		dto.names = env.nameCount();
		dto.levels = env.levelCount();
		dto.expressions = env.exprCount();
		for (int nameIndex : env.getDeclarationNames())
		{
			dto.declarations.add(declarationToDTO(env, nameIndex));
		}
		return dto;
	}

	private static DeclarationDTO declarationToDTO(Environment env, int nameIndex)
	{
		Declaration declaration = env.getDeclaration(nameIndex);
		DeclarationDTO dto = new DeclarationDTO();
		dto.name = env.renderName(nameIndex);
		dto.type = env.renderExpr(declaration.getType());
		declaration.getLevelParams().forEach(p -> dto.levelParams.add(env.renderName(p)));

		if (declaration instanceof Definition def)
		{
			dto.kind = "definition";
			dto.value = env.renderExpr(def.getValue());
		}
		else if (declaration instanceof Inductive ind)
		{
			dto.kind = "inductive";
			dto.numParams = ind.getNumParams();
			dto.constructors = new ArrayList<>();
			for (Constructor constructor : ind.getConstructors())
			{
				ConstructorDTO cd = new ConstructorDTO();
				cd.name = env.renderName(constructor.name());
				cd.type = env.renderExpr(constructor.type());
				dto.constructors.add(cd);
			}
		}
		return dto;
	}

	public static String toJson(EnvironmentDTO dto)
	{
		Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
		return gson.toJson(dto);
	}

	/**
	 * Writes the summary to a JSON file, replacing any previous content.
	 */
	public static void write(EnvironmentDTO dto, Path outPath) throws IOException
	{
		Path parent = outPath.toAbsolutePath().getParent();
		if (parent != null)
		{
			Files.createDirectories(parent);
		}
		Files.writeString(outPath, toJson(dto), StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
		Debug.logInfo("Wrote summary to: " + outPath);
	}
}
