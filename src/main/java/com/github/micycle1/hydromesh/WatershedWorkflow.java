package com.github.micycle1.hydromesh;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.operation.linemerge.LineMerger;
import org.locationtech.jts.operation.union.UnaryUnionOp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.hydromesh.clean.CleanedTopology;
import com.github.micycle1.hydromesh.clean.TopologyCleaner;
import com.github.micycle1.hydromesh.raster.ColoredRaster;
import com.github.micycle1.hydromesh.raster.Raster;
import com.github.micycle1.hydromesh.raster.RasterSampler;
import com.github.micycle1.hydromesh.raster.SamplingAlgorithm;
import com.github.micycle1.hydromesh.river.RiverForest;
import com.github.micycle1.hydromesh.source.CoordinateReprojector;
import com.github.micycle1.hydromesh.source.Crs;
import com.github.micycle1.hydromesh.source.HucCodes;
import com.github.micycle1.hydromesh.source.HucFeature;
import com.github.micycle1.hydromesh.source.HucLocator;
import com.github.micycle1.hydromesh.source.ShapeCollection;
import com.github.micycle1.hydromesh.source.ShapeSource;
import com.github.micycle1.hydromesh.split.SplitBoundary;
import com.github.micycle1.hydromesh.triangulation.ConstrainedTriangulationKernel;
import com.github.micycle1.hydromesh.triangulation.Mesh;
import com.github.micycle1.hydromesh.triangulation.TinfourTriangulationKernel;
import com.github.micycle1.hydromesh.triangulation.TriangulationOptions;
import com.github.micycle1.hydromesh.triangulation.Triangulator;
import com.github.micycle1.hydromesh.util.GeometryUtil;

/**
 * Entry point for the whole workflow: load HUCs and reaches from a source,
 * clean them into a consistent topology, triangulate, and drape the mesh onto
 * a DEM.
 * <p>
 * A {@code null} CRS argument means "keep the source's CRS" and a
 * {@code null} digits argument means {@link WorkflowConfig#getDigits()}.
 */
public class WatershedWorkflow {

	private static final Logger LOGGER = LoggerFactory.getLogger(WatershedWorkflow.class);

	private final WorkflowConfig config;
	private final CoordinateReprojector reprojector;
	private final TopologyCleaner cleaner;
	private final Triangulator triangulator;
	private final RasterSampler sampler;
	private final HucLocator locator;

	public WatershedWorkflow(WorkflowConfig config) {
		this(config, CoordinateReprojector.identity(), new TinfourTriangulationKernel(config.getMaxRefinementPasses()));
	}

	public WatershedWorkflow(WorkflowConfig config, CoordinateReprojector reprojector, ConstrainedTriangulationKernel kernel) {
		this.config = Objects.requireNonNull(config);
		this.reprojector = Objects.requireNonNull(reprojector);
		this.cleaner = new TopologyCleaner(config.getSnapRadiusFactor());
		this.triangulator = new Triangulator(kernel);
		this.sampler = new RasterSampler(reprojector);
		this.locator = new HucLocator(reprojector);
	}

	public WorkflowConfig getConfig() {
		return config;
	}

	/**
	 * The single HUC with the given code.
	 */
	public ShapeCollection<HucFeature> getHuc(ShapeSource source, String huc, Crs crs, Integer digits) {
		String code = HucCodes.normalize(huc);
		ShapeCollection<HucFeature> hucs = getHucs(source, code, code.length(), crs, digits);
		if (hucs.size() != 1) {
			throw new IllegalStateException(source.getName() + ": expected one HUC for '" + code + "', found " + hucs.size());
		}
		return hucs;
	}

	/**
	 * All HUCs of {@code level} inside {@code huc}, reprojected and rounded.
	 *
	 * @param level null for the level of {@code huc} itself
	 */
	public ShapeCollection<HucFeature> getHucs(ShapeSource source, String huc, Integer level, Crs crs, Integer digits) {
		String code = HucCodes.normalize(huc);
		int lvl = level == null ? code.length() : level;
		LOGGER.info("");
		LOGGER.info("Preprocessing HUC");
		LOGGER.info("------------------------------");
		LOGGER.info("Loading level {} HUCs in {}.", lvl, code);
		ShapeCollection<HucFeature> hucs = source.getHucs(code, lvl);
		LOGGER.info("  found {} HUCs.", hucs.size());
		for (HucFeature hu : hucs.getItems()) {
			LOGGER.info("  -- {}", hu.getCode());
		}

		Crs out = crs == null ? hucs.getCrs() : crs;
		List<HucFeature> converted = new ArrayList<>(hucs.size());
		for (HucFeature hu : hucs.getItems()) {
			Polygon shape = (Polygon) reprojector.reproject(hu.getShape(), hucs.getCrs(), out);
			GeometryUtil.round(shape, digits(digits));
			converted.add(hu.withShape(shape));
		}
		return new ShapeCollection<>(out, converted);
	}

	/**
	 * The HUCs of {@code level} inside {@code huc} in split form.
	 */
	public SplitBoundary getSplitFormHucs(ShapeSource source, String huc, Integer level, Crs crs, Integer digits) {
		ShapeCollection<HucFeature> hucs = getHucs(source, huc, level, crs, digits);
		List<Polygon> shapes = new ArrayList<>(hucs.size());
		for (HucFeature hu : hucs.getItems()) {
			shapes.add(hu.getShape());
		}
		return new SplitBoundary(shapes);
	}

	/**
	 * Reaches in the HUC and/or bounds.
	 *
	 * @param bounds    optional bounding box in {@code crs}
	 * @param maxLength reaches at least this long are dropped; null keeps all
	 * @param merge     join reaches that meet without a confluence
	 */
	public ShapeCollection<LineString> getReaches(ShapeSource source, String huc, Envelope bounds, Crs crs, Integer digits, Double maxLength,
			boolean merge) {
		LOGGER.info("");
		LOGGER.info("Preprocessing Hydrography");
		LOGGER.info("------------------------------");
		LOGGER.info("Loading streams in HUC {}", huc);
		LOGGER.info("         and/or bounds {}", bounds);
		ShapeCollection<LineString> hydro = source.getHydro(HucCodes.normalize(huc), bounds, crs);
		LOGGER.info("  found {} reaches", hydro.size());

		Crs out = crs == null ? hydro.getCrs() : crs;
		List<LineString> reaches = new ArrayList<>(hydro.size());
		for (LineString reach : hydro.getItems()) {
			LineString r = (LineString) reprojector.reproject(reach, hydro.getCrs(), out);
			GeometryUtil.round(r, digits(digits));
			reaches.add(r);
		}

		if (merge && !reaches.isEmpty()) {
			LineMerger merger = new LineMerger();
			merger.add(reaches);
			List<LineString> merged = new ArrayList<>();
			for (Object o : merger.getMergedLineStrings()) {
				merged.add((LineString) o);
			}
			reaches = merged;
		}
		if (maxLength != null) {
			List<LineString> kept = new ArrayList<>(reaches.size());
			for (LineString reach : reaches) {
				if (reach.getLength() < maxLength) {
					kept.add(reach);
				}
			}
			reaches = kept;
		}
		return new ShapeCollection<>(out, reaches);
	}

	/**
	 * A raster covering the shape grown by {@code buffer}.
	 */
	public Raster getRasterOnShape(ShapeSource source, Geometry shape, Crs crs, double buffer) {
		LOGGER.info("");
		LOGGER.info("Preprocessing Raster");
		LOGGER.info("------------------------------");
		Geometry region = shape.getNumGeometries() > 1 ? UnaryUnionOp.union(shape) : shape;
		region = region.buffer(buffer);
		LOGGER.info("collecting raster");
		return source.getRaster(region, crs);
	}

	/**
	 * A raster covering the shape, with pixels outside it set to {@code nodata}.
	 */
	public Raster getMaskedRasterOnShape(ShapeSource source, Geometry shape, Crs crs, double nodata, double buffer) {
		Raster raster = getRasterOnShape(source, shape, crs, buffer);
		Geometry local = reprojector.reproject(shape, crs, raster.getProfile().getCrs());
		return RasterSampler.mask(raster, local, nodata);
	}

	/**
	 * Smallest HUC containing the shape, searching down from {@code hint}.
	 */
	public String findHuc(ShapeSource source, Geometry shape, Crs crs, String hint, double shrinkFactor) {
		return locator.find(source, shape, crs, hint, shrinkFactor);
	}

	public String findHuc(ShapeSource source, Geometry shape, Crs crs, String hint) {
		return findHuc(source, shape, crs, hint, HydroConstants.DEFAULT_SHRINK_FACTOR);
	}

	/**
	 * Cleans the boundary (in place) and reaches into a consistent topology. Both
	 * must be in the same CRS.
	 */
	public CleanedTopology simplifyAndPrune(SplitBoundary boundary, List<LineString> reaches, double tolerance, int pruneReachSize,
			boolean cutIntersections) {
		return cleaner.simplifyAndPrune(boundary, reaches, tolerance, pruneReachSize, cutIntersections);
	}

	public Mesh triangulate(SplitBoundary boundary, RiverForest rivers, TriangulationOptions options) {
		return triangulator.triangulate(boundary, rivers, options);
	}

	public Mesh elevate(Mesh mesh, Crs meshCrs, Raster dem, SamplingAlgorithm algorithm) {
		return sampler.elevate(mesh, meshCrs, dem, algorithm);
	}

	public double[] valuesFromRaster(Coordinate[] points, Crs pointsCrs, Raster raster,
			SamplingAlgorithm algorithm) {
		return sampler.valuesFromRaster(points, pointsCrs, raster, algorithm);
	}

	public ColoredRaster colorRasterFromShapes(Envelope bounds, double pixelSize, List<? extends Geometry> shapes, int[] colors, Crs crs,
			int nodata) {
		return RasterSampler.colorRasterFromShapes(bounds, pixelSize, shapes, colors, crs, nodata);
	}

	private int digits(Integer digits) {
		return digits == null ? config.getDigits() : digits;
	}
}
