package org.imagesift;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Sorts images into label folders under {@code final} by aspect ratio or shape.
 *
 * <p>
 * Dimensions are decoded on the worker pool; moves happen sequentially in input order so
 * that name collisions resolve deterministically. Undecodable files pass through.
 */
public class ClassifyStage extends AbstractStage {

	static final String OTHER = "other";

	static final String ANIMATED = "animated";

	private final PipelineConfiguration.ClassifySettings settings;

	public ClassifyStage(PipelineConfiguration.ClassifySettings settings) {
		this.settings = settings;
	}

	@Override
	public PipelineStage stage() {
		return PipelineStage.CLASSIFY;
	}

	@Override
	protected List<Path> process(List<Path> files, PipelineContext context) {
		List<@Nullable String> labels = context.executor().map(files, file -> labelFor(file, context),
				(done, total) -> context.progress(stage(), done, total));

		ShadowWorkspace workspace = context.workspace();
		List<Path> result = new ArrayList<>(files.size());
		for (int i = 0; i < files.size(); i++) {
			Path file = files.get(i);
			String label = labels.get(i);
			if (context.isCancelled() || label == null) {
				result.add(file);
				continue;
			}
			try {
				Path target = context.reserve(workspace.finalDir().resolve(label).resolve(file.getFileName()), file);
				Path moved = workspace.simulateRename(file, target);
				context.label(moved, leafLabel(label));
				context.publish(stage(), file, moved, EventOutcome.OK, "classified as " + label);
				result.add(moved);
			}
			catch (Exception e) {
				context.failed(stage(), file, e);
				result.add(file);
			}
		}
		return result;
	}

	@Nullable
	private String labelFor(Path file, PipelineContext context) {
		try {
			DecodedImage image = context.codec().decode(file);
			return classify(image.width(), image.height(), image.animated());
		}
		catch (DecodeException e) {
			context.publish(stage(), file, file, EventOutcome.SKIPPED, "not decodable, left in place: " + e.getMessage());
			return null;
		}
		catch (RuntimeException e) {
			context.failed(stage(), file, e);
			return null;
		}
	}

	/**
	 * Label for an image of the given size, e.g. {@code 4x3}, {@code other},
	 * {@code landscape}, or {@code animated/4x3}.
	 */
	public String classify(int width, int height, boolean animated) {
		String label = settings.mode() == ClassifyMode.SHAPE ? shapeLabel(width, height) : ratioLabel(width, height);
		return animated && settings.separateAnimated() ? ANIMATED + "/" + label : label;
	}

	String ratioLabel(int width, int height) {
		double ratio = (double) width / height;
		@Nullable
		AspectRatio best = null;
		double bestDiff = Double.MAX_VALUE;
		for (AspectRatio candidate : settings.ratios()) {
			double diff = Math.abs(ratio - candidate.value()) / candidate.value();
			if (diff < bestDiff) {
				best = candidate;
				bestDiff = diff;
			}
			if (diff <= settings.ratioTolerance()) {
				return candidate.label();
			}
		}
		if (settings.snap() && best != null) {
			return best.label();
		}
		return OTHER;
	}

	String shapeLabel(int width, int height) {
		double ratio = (double) width / height;
		if (Math.abs(ratio - 1.0) <= settings.shapeTolerance()) {
			return "square";
		}
		return width > height ? "landscape" : "portrait";
	}

	private static String leafLabel(String label) {
		int slash = label.lastIndexOf('/');
		return slash >= 0 ? label.substring(slash + 1) : label;
	}

}
