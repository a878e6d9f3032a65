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
package net.preibisch.steerpyr;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Threads
{
	private static final Logger LOG = LoggerFactory.getLogger( Threads.class );

	/**
	 * @return num threads for the executorService, one per available core but at least 2
	 */
	public static int numThreads() { return Math.max( 2, Runtime.getRuntime().availableProcessors() ); }

	public static ExecutorService createFixedExecutorService( final int nThreads ) { return Executors.newFixedThreadPool( nThreads ); }
	public static ExecutorService createFixedExecutorService() { return createFixedExecutorService( numThreads() ); }

	/**
	 * Runs all tasks and collects their results in task order. A task that fails aborts the whole job,
	 * the exception names the index of the failing task. If the calling thread is interrupted, the interrupt
	 * flag is restored and the remaining tasks are cancelled.
	 *
	 * @param tasks - the tasks
	 * @param taskExecutor - the service to run them on
	 * @param jobDescription - used for logging and error messages
	 * @return the results, one per task
	 */
	public static < T > List< T > execTasks( final List< ? extends Callable< T > > tasks, final ExecutorService taskExecutor, final String jobDescription )
	{
		final List< Future< T > > futures;

		try
		{
			// invokeAll() returns when all tasks are complete
			futures = taskExecutor.invokeAll( tasks );
		}
		catch ( final InterruptedException e )
		{
			Thread.currentThread().interrupt();
			throw new CancellationException( "Interrupted while trying to " + jobDescription );
		}

		final ArrayList< T > results = new ArrayList<>( futures.size() );

		for ( int i = 0; i < futures.size(); ++i )
		{
			try
			{
				results.add( futures.get( i ).get() );
			}
			catch ( final InterruptedException e )
			{
				Thread.currentThread().interrupt();
				throw new CancellationException( "Interrupted while trying to " + jobDescription );
			}
			catch ( final ExecutionException e )
			{
				LOG.warn( "Failed to {} (task {}): {}", jobDescription, i, e.getCause().toString() );
				throw new RuntimeException( "Failed to " + jobDescription + " (task " + i + ")", e.getCause() );
			}
		}

		return results;
	}
}
