/*-
 * #%L
 * Complex steerable pyramid decomposition and reconstruction
 * of two-dimensional images.
 * %%
 * Copyright (C) 2024 - 2026 Steerable Pyramid developers.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 2 of the
 * License, or (at your option) any later version.
 * 
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-2.0.html>.
 * #L%
 */
package net.preibisch.steerpyr.pyramid;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.img.basictypeaccess.array.IntArray;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.integer.IntType;
import net.imglib2.type.numeric.real.DoubleType;
import net.preibisch.steerpyr.Threads;
import net.preibisch.steerpyr.spectrum.JTransformsSpectrumOps;
import net.preibisch.steerpyr.spectrum.SpectrumOps;

/**
 * Entry point for decomposing images into complex steerable pyramids and reconstructing them. Builder and
 * reconstructor share one {@link FilterBankCache}, so the masks of every image size are computed once.
 * Instances are thread-safe.
 */
public class SteerablePyramid
{
	private static final Logger LOG = LoggerFactory.getLogger( SteerablePyramid.class );

	final PyramidParameters parameters;
	final FilterBankCache filters;
	final PyramidBuilder builder;
	final PyramidReconstructor reconstructor;

	public SteerablePyramid( final PyramidParameters parameters, final SpectrumOps ops )
	{
		this.parameters = parameters;
		this.filters = new FilterBankCache( parameters );
		this.builder = new PyramidBuilder( parameters, ops, filters );
		this.reconstructor = new PyramidReconstructor( parameters, ops, filters );
	}

	public SteerablePyramid( final PyramidParameters parameters )
	{
		this( parameters, new JTransformsSpectrumOps() );
	}

	public SteerablePyramid()
	{
		this( new PyramidParameters() );
	}

	/**
	 * @param image - a 2d grayscale image, it is not modified
	 * @return the pyramid
	 */
	public < T extends RealType< T > > PyramidCoefficients build( final RandomAccessibleInterval< T > image )
	{
		return builder.build( image );
	}

	/**
	 * @param coeff - a pyramid built with the same parameters
	 * @return the reconstructed image, rounded to the nearest integer
	 */
	public ArrayImg< IntType, IntArray > reconstruct( final PyramidCoefficients coeff )
	{
		return reconstructor.reconstruct( coeff );
	}

	/**
	 * @param coeff - a pyramid built with the same parameters
	 * @return the reconstructed image without rounding
	 */
	public ArrayImg< DoubleType, DoubleArray > reconstructReal( final PyramidCoefficients coeff )
	{
		return reconstructor.reconstructReal( coeff );
	}

	/**
	 * Decomposes several images in parallel, one task per image.
	 *
	 * @param images - 2d grayscale images, sizes may differ
	 * @param service - the executor to run on
	 * @return the pyramids in the order of the images
	 */
	public < T extends RealType< T > > List< PyramidCoefficients > buildAll( final List< ? extends RandomAccessibleInterval< T > > images, final ExecutorService service )
	{
		final ArrayList< Callable< PyramidCoefficients > > tasks = new ArrayList<>();

		for ( final RandomAccessibleInterval< T > image : images )
			tasks.add( () -> build( image ) );

		LOG.info( "Building {} pyramids ({}).", tasks.size(), parameters );

		final List< PyramidCoefficients > result = Threads.execTasks( tasks, service, "build steerable pyramids" );

		LOG.info( "Built {} pyramids, {} filter bank(s) cached.", result.size(), filters.size() );

		return result;
	}

	public < T extends RealType< T > > List< PyramidCoefficients > buildAll( final List< ? extends RandomAccessibleInterval< T > > images )
	{
		final ExecutorService service = Threads.createFixedExecutorService();

		try
		{
			return buildAll( images, service );
		}
		finally
		{
			service.shutdown();
		}
	}

	/**
	 * Reconstructs several pyramids in parallel, one task per pyramid.
	 *
	 * @param coeffs - pyramids built with the same parameters
	 * @param service - the executor to run on
	 * @return the rounded reconstructions in the order of the pyramids
	 */
	public List< ArrayImg< IntType, IntArray > > reconstructAll( final List< PyramidCoefficients > coeffs, final ExecutorService service )
	{
		final ArrayList< Callable< ArrayImg< IntType, IntArray > > > tasks = new ArrayList<>();

		for ( final PyramidCoefficients coeff : coeffs )
			tasks.add( () -> reconstruct( coeff ) );

		LOG.info( "Reconstructing {} images ({}).", tasks.size(), parameters );

		return Threads.execTasks( tasks, service, "reconstruct images from steerable pyramids" );
	}

	public List< ArrayImg< IntType, IntArray > > reconstructAll( final List< PyramidCoefficients > coeffs )
	{
		final ExecutorService service = Threads.createFixedExecutorService();

		try
		{
			return reconstructAll( coeffs, service );
		}
		finally
		{
			service.shutdown();
		}
	}

	/**
	 * @param rows - image height
	 * @param cols - image width
	 * @return the masks used for images of that size
	 */
	public PyramidFilters getFilters( final int rows, final int cols )
	{
		parameters.checkImageSize( rows, cols );
		return filters.get( rows, cols );
	}

	public static long[] levelShape( final PyramidCoefficients coeff, final int level )
	{
		return coeff.levelShape( level );
	}

	public PyramidParameters getParameters() { return parameters; }
	public FilterBankCache getFilterBankCache() { return filters; }
	public PyramidBuilder getBuilder() { return builder; }
	public PyramidReconstructor getReconstructor() { return reconstructor; }
}
