/**
** -----------------------------------------------------------------------------**
** LeastSquaresSolver.java
**
** Numeric backend solving overdetermined linear systems
**
**
** Copyright (C) 2014 Elphel, Inc.
**
** -----------------------------------------------------------------------------**
**
**  LeastSquaresSolver.java is free software: you can redistribute it and/or modify
**  it under the terms of the GNU General Public License as published by
**  the Free Software Foundation, either version 3 of the License, or
**  (at your option) any later version.
**
**  This program is distributed in the hope that it will be useful,
**  but WITHOUT ANY WARRANTY; without even the implied warranty of
**  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
**  GNU General Public License for more details.
**
**  You should have received a copy of the GNU General Public License
**  along with this program.  If not, see <http://www.gnu.org/licenses/>.
** -----------------------------------------------------------------------------**
**
*/

public interface LeastSquaresSolver {
	/**
	 * @return false if the backend can not be used (missing library, etc.)
	 */
	boolean isAvailable();

	String getName();

	/**
	 * Minimize |A*x-b|
	 * @param a matrix, rows x columns, rows &gt;= columns
	 * @param b right side, rows
	 * @return x, columns
	 * @throws CRFException UNSUPPORTED_BACKEND if the backend fails to run
	 */
	double [] solve(double [][] a, double [] b) throws CRFException;
}
