package net.preibisch.steerpyr.pyramid;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;

import org.junit.Test;

import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.img.basictypeaccess.array.IntArray;
import net.imglib2.type.numeric.integer.IntType;
import net.imglib2.type.numeric.real.DoubleType;
import net.preibisch.steerpyr.Threads;

public class SteerablePyramidTest
{
	@Test
	public void testDefaults()
	{
		final SteerablePyramid pyramid = new SteerablePyramid();

		assertEquals( new PyramidParameters( 5, 4, 2 ), pyramid.getParameters() );
		assertSame( pyramid.getParameters(), pyramid.getBuilder().getParameters() );
		assertSame( pyramid.getParameters(), pyramid.getReconstructor().getParameters() );
	}

	@Test
	public void testFilterBankIsSharedAndCached()
	{
		final SteerablePyramid pyramid = new SteerablePyramid( new PyramidParameters( 4, 4 ) );

		final PyramidCoefficients coeff = pyramid.build( PyramidTestImages.random( 64, 64, 1 ) );
		assertEquals( 1, pyramid.getFilterBankCache().size() );

		pyramid.reconstruct( coeff );
		pyramid.build( PyramidTestImages.random( 64, 64, 2 ) );
		assertEquals( 1, pyramid.getFilterBankCache().size() );

		assertSame( pyramid.getFilters( 64, 64 ), pyramid.getFilters( 64, 64 ) );

		pyramid.build( PyramidTestImages.random( 64, 80, 3 ) );
		assertEquals( 2, pyramid.getFilterBankCache().size() );
	}

	@Test
	public void testBatch()
	{
		final SteerablePyramid pyramid = new SteerablePyramid( new PyramidParameters( 4, 4 ) );

		final List< ArrayImg< DoubleType, DoubleArray > > images = new ArrayList<>();
		images.add( PyramidTestImages.random( 64, 64, 21 ) );
		images.add( PyramidTestImages.grating( 64, 64, 1.0, 5 ) );
		images.add( PyramidTestImages.random( 80, 64, 22 ) );

		final ExecutorService service = Threads.createFixedExecutorService( 2 );

		try
		{
			final List< PyramidCoefficients > coeffs = pyramid.buildAll( images, service );
			assertEquals( 3, coeffs.size() );
			assertEquals( 80, SteerablePyramid.levelShape( coeffs.get( 2 ), 0 )[ 0 ] );

			final List< ArrayImg< IntType, IntArray > > recs = pyramid.reconstructAll( coeffs, service );
			assertEquals( 3, recs.size() );

			for ( int i = 0; i < images.size(); ++i )
				assertTrue( "image " + i, PyramidReconstructorTest.maxDifference( images.get( i ), recs.get( i ) ) <= 2 );
		}
		finally
		{
			service.shutdown();
		}

		assertEquals( 2, pyramid.getFilterBankCache().size() );
	}

	@Test
	public void testBatchFailureNamesTheImage()
	{
		final SteerablePyramid pyramid = new SteerablePyramid( new PyramidParameters( 4, 4 ) );

		final List< ArrayImg< DoubleType, DoubleArray > > images = new ArrayList<>();
		images.add( PyramidTestImages.random( 64, 64, 31 ) );
		images.add( ArrayImgs.doubles( 16, 16 ) );

		try
		{
			pyramid.buildAll( images );
			fail( "expected the second image to fail" );
		}
		catch ( final RuntimeException e )
		{
			assertTrue( e.getMessage(), e.getMessage().contains( "task 1" ) );
			assertEquals( PyramidConfigurationException.class, e.getCause().getClass() );
		}
	}

	@Test
	public void testAmplitudeAndPhase()
	{
		final SteerablePyramid pyramid = new SteerablePyramid( new PyramidParameters( 3, 4 ) );
		final PyramidCoefficients coeff = pyramid.build( PyramidTestImages.grating( 32, 32, 0, 4 ) );

		final ArrayImg< DoubleType, DoubleArray > amplitude = Subbands.amplitude( coeff.getBand( 1, 0 ) );
		final ArrayImg< DoubleType, DoubleArray > phase = Subbands.phase( coeff.getBand( 1, 0 ) );

		assertEquals( 32, amplitude.dimension( 0 ) );
		assertEquals( 32, phase.dimension( 1 ) );

		for ( final DoubleType t : amplitude )
			assertTrue( t.get() >= 0 );

		for ( final DoubleType t : phase )
			assertTrue( t.get() >= -Math.PI && t.get() <= Math.PI );
	}
}
