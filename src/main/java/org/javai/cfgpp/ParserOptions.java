package org.javai.cfgpp;

import java.nio.file.Path;
import java.util.List;

/**
 * Settings for a {@link CfgParser}.
 *
 * @param expandEnvVars replace {@code ${NAME}} references with environment values;
 *        when false the raw reference text is kept as a string
 * @param processIncludes honour {@code @include}/{@code @import}; when false a directive is a syntax error
 * @param maxIncludeDepth how many includes may be nested inside each other
 * @param includePaths roots searched in order for included files
 * @param syntaxOnly check the grammar without building the value tree
 * @param detectIncludeCycles fail as soon as a file includes itself, directly or transitively
 */
public record ParserOptions(
		boolean expandEnvVars,
		boolean processIncludes,
		int maxIncludeDepth,
		List<Path> includePaths,
		boolean syntaxOnly,
		boolean detectIncludeCycles
) {

	public static final int DEFAULT_MAX_INCLUDE_DEPTH = 10;

	public ParserOptions {
		if (maxIncludeDepth < 0) {
			throw new IllegalArgumentException("maxIncludeDepth must not be negative: " + maxIncludeDepth);
		}
		includePaths = includePaths != null && !includePaths.isEmpty()
				? List.copyOf(includePaths)
				: List.of(Path.of("."));
	}

	public static ParserOptions defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public Builder toBuilder() {
		return new Builder()
				.expandEnvVars(expandEnvVars)
				.processIncludes(processIncludes)
				.maxIncludeDepth(maxIncludeDepth)
				.includePaths(includePaths)
				.syntaxOnly(syntaxOnly)
				.detectIncludeCycles(detectIncludeCycles);
	}

	public static final class Builder {
		private boolean expandEnvVars = true;
		private boolean processIncludes = true;
		private int maxIncludeDepth = DEFAULT_MAX_INCLUDE_DEPTH;
		private List<Path> includePaths = List.of(Path.of("."));
		private boolean syntaxOnly = false;
		private boolean detectIncludeCycles = true;

		private Builder() {
		}

		public Builder expandEnvVars(boolean expandEnvVars) {
			this.expandEnvVars = expandEnvVars;
			return this;
		}

		public Builder processIncludes(boolean processIncludes) {
			this.processIncludes = processIncludes;
			return this;
		}

		public Builder maxIncludeDepth(int maxIncludeDepth) {
			this.maxIncludeDepth = maxIncludeDepth;
			return this;
		}

		public Builder includePaths(List<Path> includePaths) {
			this.includePaths = includePaths;
			return this;
		}

		public Builder includePath(Path includePath) {
			this.includePaths = List.of(includePath);
			return this;
		}

		public Builder syntaxOnly(boolean syntaxOnly) {
			this.syntaxOnly = syntaxOnly;
			return this;
		}

		public Builder detectIncludeCycles(boolean detectIncludeCycles) {
			this.detectIncludeCycles = detectIncludeCycles;
			return this;
		}

		public ParserOptions build() {
			return new ParserOptions(expandEnvVars, processIncludes, maxIncludeDepth, includePaths,
					syntaxOnly, detectIncludeCycles);
		}
	}
}
