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

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the {@link PyramidFilters} of each image size once and hands out the same instance afterwards.
 */
public class FilterBankCache
{
	private static final Logger LOG = LoggerFactory.getLogger( FilterBankCache.class );

	final PyramidParameters parameters;
	final Map< String, PyramidFilters > filters = new ConcurrentHashMap<>();

	public FilterBankCache( final PyramidParameters parameters )
	{
		this.parameters = parameters;
	}

	public PyramidParameters getParameters() { return parameters; }

	/**
	 * @param rows - image height
	 * @param cols - image width
	 * @return the filter bank for images of that size
	 */
	public PyramidFilters get( final int rows, final int cols )
	{
		return filters.computeIfAbsent( rows + "x" + cols, k ->
		{
			LOG.debug( "Computing filter bank for {}x{} ({})", rows, cols, parameters );
			return PyramidFilters.create( parameters, rows, cols );
		} );
	}

	/** @return number of image sizes with a cached filter bank */
	public int size() { return filters.size(); }

	public void clear() { filters.clear(); }
}
