package daddy.formatters;

import daddy.model.pygmy.PygmyType;

import java.io.IOException;
import java.util.List;

public class FormattingTools {
	private FormattingTools() {}

	/**
	 * Writes a compile-time value (integer, boolean, type or list of those) the way it would be written in
	 * source.
	 */
	public static void writeStaticValue(IndentingWriter out, Object value) throws IOException {
		if (value == null) {
			out.write("None");
		} else if (value instanceof Boolean) {
			out.write((Boolean) value ? "True" : "False");
		} else if (value instanceof List) {
			out.write("[");
			boolean first = true;
			for (Object item : (List<?>) value) {
				if (!first) {
					out.write(", ");
				}
				first = false;
				writeStaticValue(out, item);
			}
			out.write("]");
		} else if (value instanceof PygmyType) {
			out.write(((PygmyType) value).getName());
		} else {
			out.write(value.toString());
		}
	}

	public static <T> void writeCommaSeparated(IndentingWriter out, List<T> items, ItemWriter<T> writer)
			throws IOException {
		boolean first = true;
		for (T item : items) {
			if (!first) {
				out.write(", ");
			}
			first = false;
			writer.write(item);
		}
	}

	@FunctionalInterface
	public interface ItemWriter<T> {
		void write(T item) throws IOException;
	}
}
