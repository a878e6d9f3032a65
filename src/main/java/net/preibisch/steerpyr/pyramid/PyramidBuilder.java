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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.complex.ComplexDoubleType;
import net.imglib2.type.numeric.real.DoubleType;
import net.preibisch.steerpyr.pyramid.PyramidFilters.BandFilters;
import net.preibisch.steerpyr.spectrum.ImaginaryUnit;
import net.preibisch.steerpyr.spectrum.SpectrumOps;
import util.ImgLib2Tools;

/**
 * Decomposes an image into a complex steerable pyramid (Portilla &amp; Simoncelli, IJCV 40(1):49-71, 2000) by
 * recursively splitting its centered spectrum:
 * <ol>
 * <li>the spectrum is split into a high-pass residual (hi0) and a low-pass part (lo0),</li>
 * <li>the low-pass part is filtered into nbands oriented subbands with the radial band-pass mask of the level,</li>
 * <li>the low-pass part is cropped to the next octave and filtered with the complementary low-pass mask,</li>
 * <li>2. and 3. repeat on the cropped spectrum until only the low-pass residual is left.</li>
 * </ol>
 * Every subband is multiplied by the constant phase (-i)^(nbands-1) and kept complex.
 */
public class PyramidBuilder
{
	private static final Logger LOG = LoggerFactory.getLogger( PyramidBuilder.class );

	final PyramidParameters parameters;
	final SpectrumOps ops;
	final FilterBankCache filters;

	public PyramidBuilder( final PyramidParameters parameters, final SpectrumOps ops, final FilterBankCache filters )
	{
		if ( !parameters.equals( filters.getParameters() ) )
			throw new IllegalArgumentException( "Filter bank (" + filters.getParameters() + ") does not match the parameters (" + parameters + ")." );

		this.parameters = parameters;
		this.ops = ops;
		this.filters = filters;
	}

	/**
	 * @param image - a 2d grayscale image, it is not modified
	 * @return the pyramid
	 * @throws ShapeMismatchException if the image is not 2d
	 * @throws PyramidConfigurationException if the pyramid is too high for the image size
	 */
	public < T extends RealType< T > > PyramidCoefficients build( final RandomAccessibleInterval< T > image )
	{
		if ( image.numDimensions() != 2 )
		{
			LOG.warn( "Rejecting a {}-dimensional image.", image.numDimensions() );
			throw new ShapeMismatchException( "Input image must be 2d grayscale, but has " + image.numDimensions() + " dimension(s)." );
		}

		final int rows = ImgLib2Tools.rows( image );
		final int cols = ImgLib2Tools.cols( image );

		parameters.checkImageSize( rows, cols );

		final PyramidFilters bank = filters.get( rows, cols );

		final ArrayImg< ComplexDoubleType, DoubleArray > imdft = ops.forwardCentered( ops.toComplex( ImgLib2Tools.copyToDouble( image ) ) );

		// low-pass, recursively split into the band-pass levels
		final ArrayImg< ComplexDoubleType, DoubleArray > lo0dft = ops.multiply( imdft, bank.getLo0Mask() );
		final List< PyramidLevel > levels = buildLevels( lo0dft, bank, 0 );

		// high-pass
		final ArrayImg< ComplexDoubleType, DoubleArray > hi0dft = ops.multiply( imdft, bank.getHi0Mask() );
		final ArrayImg< DoubleType, DoubleArray > hi0 = ops.real( ops.inverseCentered( hi0dft ) );

		LOG.debug( "High-pass: {}x{}", rows, cols );

		levels.add( 0, new HighPassLevel( hi0 ) );

		return new PyramidCoefficients( parameters, levels );
	}

	/**
	 * @param lodft - the centered low-pass spectrum of this level
	 * @param bank - the masks
	 * @param index - index of the band-pass level (0 is pyramid level 1)
	 * @return the levels from this one down to the low-pass residual
	 */
	protected List< PyramidLevel > buildLevels( final ArrayImg< ComplexDoubleType, DoubleArray > lodft, final PyramidFilters bank, final int index )
	{
		if ( index >= bank.numBandPassLevels() )
		{
			final ArrayImg< DoubleType, DoubleArray > lo0 = ops.real( ops.inverseCentered( lodft ) );

			LOG.debug( "Low-pass: {}x{}", ImgLib2Tools.rows( lo0 ), ImgLib2Tools.cols( lo0 ) );

			final ArrayList< PyramidLevel > levels = new ArrayList<>();
			levels.add( new LowPassLevel( lo0 ) );
			return levels;
		}

		final BandFilters band = bank.getBandFilters( index );
		final ComplexDoubleType phase = ImaginaryUnit.negativePow( parameters.getOrder() );

		// orientation band-pass
		final ArrayImg< ComplexDoubleType, DoubleArray > hidft = ops.multiply( ops.multiply( lodft, band.getHiMask() ), phase );
		final ArrayList< ArrayImg< ComplexDoubleType, DoubleArray > > orientations = new ArrayList<>();

		for ( int b = 0; b < parameters.getNumBands(); ++b )
			orientations.add( ops.inverseCentered( ops.multiply( hidft, band.getAnalysisAngleMask( b ) ) ) );

		LOG.debug( "Band-pass level {}: {} orientations of {}x{}", index + 1, orientations.size(), band.getRows(), band.getCols() );

		// subsample the low-pass in the frequency domain
		final ArrayImg< ComplexDoubleType, DoubleArray > nextdft = ops.multiply( ops.crop( lodft, band.getCrop() ), band.getLoMask() );

		final List< PyramidLevel > levels = buildLevels( nextdft, bank, index + 1 );
		levels.add( 0, new BandPassLevel( orientations ) );

		return levels;
	}

	public PyramidParameters getParameters() { return parameters; }
}
