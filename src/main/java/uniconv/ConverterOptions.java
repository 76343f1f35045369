package uniconv;

import uniconv.parse.ParseMode;
import uniconv.print.FormatOptions;

public record ConverterOptions(ParseMode mode, FormatOptions format) {
	public static ConverterOptions defaults() {
		return new ConverterOptions(ParseMode.BEST_EFFORT, FormatOptions.defaults());
	}

	public ConverterOptions withMode(ParseMode mode) {
		return new ConverterOptions(mode, format);
	}

	public ConverterOptions withFormat(FormatOptions format) {
		return new ConverterOptions(mode, format);
	}
}
