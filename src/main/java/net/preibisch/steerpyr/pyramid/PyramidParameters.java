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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.preibisch.steerpyr.grid.AngularProfile;

/**
 * Immutable configuration of a complex steerable pyramid. The angular lookup tables depend only on the number of
 * orientations and are built once here, every build and reconstruct call using these parameters shares them.
 */
public class PyramidParameters
{
	private static final Logger LOG = LoggerFactory.getLogger( PyramidParameters.class );

	public static int defaultHeight = 5;
	public static int defaultNumBands = 4;
	public static double defaultScaleFactor = 2;

	final int height;
	final int nbands;
	final double scaleFactor;
	final AngularProfile angularProfile;

	/**
	 * @param height - number of levels including the high-pass and the low-pass residual, at least 2
	 * @param nbands - number of orientations per band-pass level, at least 1
	 * @param scaleFactor - radial decimation per octave, at least 2
	 */
	public PyramidParameters( final int height, final int nbands, final double scaleFactor )
	{
		if ( height < 2 )
			throw new PyramidConfigurationException( "Pyramid height must be >= 2 (high-pass and low-pass), got " + height );

		if ( nbands < 1 )
			throw new PyramidConfigurationException( "Number of orientation bands must be >= 1, got " + nbands );

		// the crop to the next octave always halves the spectrum, a smaller factor would cut off pass-band frequencies
		if ( !( scaleFactor >= 2 ) || Double.isInfinite( scaleFactor ) )
			throw new PyramidConfigurationException( "Scale factor must be finite and >= 2, got " + scaleFactor );

		this.height = height;
		this.nbands = nbands;
		this.scaleFactor = scaleFactor;
		this.angularProfile = new AngularProfile( nbands );
	}

	public PyramidParameters( final int height, final int nbands )
	{
		this( height, nbands, defaultScaleFactor );
	}

	public PyramidParameters()
	{
		this( defaultHeight, defaultNumBands, defaultScaleFactor );
	}

	public int getHeight() { return height; }
	public int getNumBands() { return nbands; }
	public double getScaleFactor() { return scaleFactor; }

	/** @return the number of oriented band-pass levels, height - 2 */
	public int getNumBandPassLevels() { return height - 2; }

	/** @return nbands - 1, the exponent of the angular tuning curve and of the phase factors */
	public int getOrder() { return nbands - 1; }

	/** @return log2( scaleFactor ), the shift of the radial transition per octave */
	public double getRadialShift() { return Math.log( scaleFactor ) / Math.log( 2 ); }

	public AngularProfile getAngularProfile() { return angularProfile; }

	/**
	 * @param rows - image height
	 * @param cols - image width
	 * @return the highest pyramid that can be built, floor( log2( min( rows, cols ) ) ) - 2
	 */
	public static int maxHeight( final int rows, final int cols )
	{
		final int min = Math.min( rows, cols );

		if ( min < 1 )
			return -2;

		// exact floor of log2 for integers
		return ( 31 - Integer.numberOfLeadingZeros( min ) ) - 2;
	}

	/**
	 * The radial transition of the last band-pass level ends at log-radius -1 - (height-2) * log2( scaleFactor ).
	 * Below that, the low-pass mask must be one at the lowest non-zero frequency of the image, log2( 2 / size ),
	 * otherwise the zero frequency (which shares its radius) leaks into the oriented subbands.
	 *
	 * @param rows - image height
	 * @param cols - image width
	 * @return the largest total radial shift, in octaves, that the image supports: log2( min( rows, cols ) ) - 2
	 */
	public static double maxRadialDepth( final int rows, final int cols )
	{
		return Math.log( Math.min( rows, cols ) ) / Math.log( 2 ) - 2;
	}

	/** @return the total radial shift of the last band-pass level in octaves, (height-2) * log2( scaleFactor ) */
	public double getRadialDepth() { return getNumBandPassLevels() * getRadialShift(); }

	/**
	 * @param rows - image height
	 * @param cols - image width
	 * @throws PyramidConfigurationException if the pyramid is too high for the image, or if its scale factor
	 * moves the last radial transition below the lowest frequency of the image
	 */
	public void checkImageSize( final int rows, final int cols )
	{
		final int max = maxHeight( rows, cols );

		if ( height > max )
		{
			LOG.warn( "Cannot build a pyramid of height {} for a {}x{} image (max {}).", height, rows, cols, max );
			throw new PyramidConfigurationException(
					"Cannot build pyramid higher than " + max + " levels for a " + rows + "x" + cols + " image, requested " + height );
		}

		final double maxDepth = maxRadialDepth( rows, cols );

		if ( getRadialDepth() > maxDepth + 1e-9 )
		{
			LOG.warn( "Scale factor {} is too large for {} band-pass levels on a {}x{} image.", scaleFactor, getNumBandPassLevels(), rows, cols );
			throw new PyramidConfigurationException(
					"Scale factor " + scaleFactor + " shifts the last of " + getNumBandPassLevels() + " band-pass levels by " + getRadialDepth() +
					" octaves, a " + rows + "x" + cols + " image supports at most " + maxDepth );
		}
	}

	@Override
	public boolean equals( final Object o )
	{
		if ( this == o )
			return true;

		if ( !( o instanceof PyramidParameters ) )
			return false;

		final PyramidParameters p = (PyramidParameters)o;

		return height == p.height && nbands == p.nbands && Double.compare( scaleFactor, p.scaleFactor ) == 0;
	}

	@Override
	public int hashCode()
	{
		return 31 * ( 31 * height + nbands ) + Double.hashCode( scaleFactor );
	}

	@Override
	public String toString()
	{
		return "height=" + height + ", nbands=" + nbands + ", scaleFactor=" + scaleFactor;
	}
}
