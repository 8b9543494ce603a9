package org.lokray.quasar.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.lokray.quasar.tac.TacProgram;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Writes a {@link TacProgram} as a pretty-printed JSON listing.
 */
public class TacListingWriter
{
	private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

	public String toJson(TacProgram program)
	{
		return gson.toJson(TacDTOConverter.toProgram(program));
	}

	public void write(TacProgram program, Path out) throws IOException
	{
		Path parent = out.toAbsolutePath().getParent();
		if (parent != null)
		{
			Files.createDirectories(parent);
		}
		Files.writeString(out, toJson(program), StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
		Debug.logInfo("Wrote three-address code listing to: " + out);
	}
}
