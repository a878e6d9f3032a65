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

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.img.basictypeaccess.array.IntArray;
import net.imglib2.type.numeric.complex.ComplexDoubleType;
import net.imglib2.type.numeric.integer.IntType;
import net.imglib2.type.numeric.real.DoubleType;
import net.preibisch.steerpyr.pyramid.PyramidFilters.BandFilters;
import net.preibisch.steerpyr.spectrum.ImaginaryUnit;
import net.preibisch.steerpyr.spectrum.SpectrumOps;
import util.ImgLib2Tools;

/**
 * Inverts {@link PyramidBuilder}: every level is transformed back to the frequency domain, multiplied by the same
 * masks it was filtered with, and summed into the spectrum of the level above. Oriented subbands are multiplied by
 * (+i)^(nbands-1), which cancels the builder's (-i)^(nbands-1) exactly. The real part of the final inverse
 * transform is the reconstructed image.
 */
public class PyramidReconstructor
{
	private static final Logger LOG = LoggerFactory.getLogger( PyramidReconstructor.class );

	final PyramidParameters parameters;
	final SpectrumOps ops;
	final FilterBankCache filters;

	public PyramidReconstructor( final PyramidParameters parameters, final SpectrumOps ops, final FilterBankCache filters )
	{
		if ( !parameters.equals( filters.getParameters() ) )
			throw new IllegalArgumentException( "Filter bank (" + filters.getParameters() + ") does not match the parameters (" + parameters + ")." );

		this.parameters = parameters;
		this.ops = ops;
		this.filters = filters;
	}

	/**
	 * @param coeff - a pyramid, it is not modified
	 * @return the reconstructed image, rounded to the nearest integer
	 * @throws ShapeMismatchException if the pyramid does not match the configured height and number of orientations,
	 * or was built with other parameters
	 */
	public ArrayImg< IntType, IntArray > reconstruct( final PyramidCoefficients coeff )
	{
		final double[] real = ImgLib2Tools.data( reconstructReal( coeff ) );
		final int[] rounded = new int[ real.length ];

		for ( int i = 0; i < real.length; ++i )
			rounded[ i ] = (int)Math.round( real[ i ] );

		final HighPassLevel hi = coeff.getHighPass();
		return ArrayImgs.ints( rounded, hi.getCols(), hi.getRows() );
	}

	/**
	 * @param coeff - a pyramid, it is not modified
	 * @return the reconstructed image without rounding
	 * @throws ShapeMismatchException if the pyramid does not match the configured height and number of orientations,
	 * or was built with other parameters
	 * @throws PyramidConfigurationException if the high-pass residual is too small for the configured height
	 */
	public ArrayImg< DoubleType, DoubleArray > reconstructReal( final PyramidCoefficients coeff )
	{
		final HighPassLevel hi = coeff.getHighPass();
		final PyramidFilters bank = checkLayout( coeff );

		final List< PyramidLevel > levels = coeff.getLevels();
		final ArrayImg< ComplexDoubleType, DoubleArray > tempdft = reconstructLevels( levels.subList( 1, levels.size() ), bank, 0 );

		final ArrayImg< ComplexDoubleType, DoubleArray > hidft = ops.forwardCentered( ops.toComplex( hi.img ) );

		final ArrayImg< ComplexDoubleType, DoubleArray > outdft = ops.multiply( tempdft, bank.getLo0Mask() );
		ops.addTo( outdft, ops.multiply( hidft, bank.getHi0Mask() ) );

		LOG.debug( "Reconstructed {}x{} from {} levels", hi.getRows(), hi.getCols(), levels.size() );

		return ops.real( ops.inverseCentered( outdft ) );
	}

	/**
	 * @param levels - the band-pass levels from this one down, followed by the low-pass residual
	 * @param bank - the masks
	 * @param index - index of the band-pass level (0 is pyramid level 1)
	 * @return the centered spectrum of this level
	 */
	protected ArrayImg< ComplexDoubleType, DoubleArray > reconstructLevels( final List< PyramidLevel > levels, final PyramidFilters bank, final int index )
	{
		if ( levels.size() == 1 )
			return ops.forwardCentered( ops.toComplex( ( (LowPassLevel)levels.get( 0 ) ).img ) );

		final BandFilters band = bank.getBandFilters( index );
		final BandPassLevel level = (BandPassLevel)levels.get( 0 );
		final ComplexDoubleType phase = ImaginaryUnit.pow( parameters.getOrder() );

		// orientation residue
		final ArrayImg< ComplexDoubleType, DoubleArray > orientdft = ArrayImgs.complexDoubles( band.getCols(), band.getRows() );

		for ( int b = 0; b < parameters.getNumBands(); ++b )
		{
			final ArrayImg< ComplexDoubleType, DoubleArray > banddft = ops.forwardCentered( level.bands.get( b ) );
			ops.addTo( orientdft, ops.multiply( banddft, band.getSynthesisAngleMask( b ) ) );
		}

		final ArrayImg< ComplexDoubleType, DoubleArray > residue = ops.multiply( ops.multiply( orientdft, band.getHiMask() ), phase );

		// the low-pass is upsampled by zero-padding its spectrum
		final ArrayImg< ComplexDoubleType, DoubleArray > nresdft = reconstructLevels( levels.subList( 1, levels.size() ), bank, index + 1 );
		final ArrayImg< ComplexDoubleType, DoubleArray > resdft = ops.embed( ops.multiply( nresdft, band.getLoMask() ), band.getCrop() );

		ops.addTo( resdft, residue );

		return resdft;
	}

	/*
	 * All checks happen before any computation, a mismatching pyramid never produces a partial result.
	 */
	protected PyramidFilters checkLayout( final PyramidCoefficients coeff )
	{
		if ( coeff.height() != parameters.getHeight() )
			throw mismatch( "Pyramid has " + coeff.height() + " levels, the reconstructor is configured for " + parameters.getHeight() );

		for ( int l = 1; l < coeff.height() - 1; ++l )
		{
			final int n = coeff.getBandPass( l ).getNumBands();

			if ( n != parameters.getNumBands() )
				throw mismatch( "Unmatched number of orientations: level " + l + " has " + n + ", expected " + parameters.getNumBands() );
		}

		// same layout but different masks, e.g. another scale factor
		if ( !parameters.equals( coeff.getParameters() ) )
			throw mismatch( "Pyramid was built with " + coeff.getParameters() + ", the reconstructor is configured for " + parameters );

		final HighPassLevel hi = coeff.getHighPass();
		parameters.checkImageSize( hi.getRows(), hi.getCols() );

		final PyramidFilters bank = filters.get( hi.getRows(), hi.getCols() );

		for ( int l = 1; l < coeff.height() - 1; ++l )
		{
			final PyramidLevel level = coeff.getLevel( l );
			final BandFilters band = bank.getBandFilters( l - 1 );

			if ( level.getRows() != band.getRows() || level.getCols() != band.getCols() )
				throw mismatch( "Level " + l + " is " + level.getRows() + "x" + level.getCols() + ", expected " + band.getRows() + "x" + band.getCols() );
		}

		final LowPassLevel lo = coeff.getLowPass();

		if ( lo.getRows() != bank.getLowPassRows() || lo.getCols() != bank.getLowPassCols() )
			throw mismatch( "Low-pass is " + lo.getRows() + "x" + lo.getCols() + ", expected " + bank.getLowPassRows() + "x" + bank.getLowPassCols() );

		return bank;
	}

	protected static ShapeMismatchException mismatch( final String message )
	{
		LOG.warn( message );
		return new ShapeMismatchException( message );
	}

	public PyramidParameters getParameters() { return parameters; }
}
