/**
** -----------------------------------------------------------------------------**
** JamaSVDSolver.java
**
** Least squares solution through singular value decomposition (Jama)
**
**
** Copyright (C) 2014 Elphel, Inc.
**
** -----------------------------------------------------------------------------**
**
**  JamaSVDSolver.java is free software: you can redistribute it and/or modify
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

import Jama.Matrix;
import Jama.SingularValueDecomposition;

/**
 * x = V * S^+ * U' * b. Singular values below max(rows,columns)*s_max*eps are treated
 * as zero, so rank deficient systems get the minimal norm solution instead of a
 * blown up one. Normal equations are not used.
 */
public class JamaSVDSolver implements LeastSquaresSolver {
	private static final double EPS=Math.pow(2.0,-52.0);
	public int debugLevel=1;

	public JamaSVDSolver(){}
	public JamaSVDSolver(int debugLevel){
		this.debugLevel=debugLevel;
	}

	public boolean isAvailable() {
		try {
			Class.forName("Jama.SingularValueDecomposition");
			return true;
		} catch (ClassNotFoundException e) {
			return false;
		} catch (LinkageError e) {
			return false;
		}
	}

	public String getName() {return "Jama SVD";}

	public double [] solve(double [][] a, double [] b) throws CRFException {
		int rows=a.length;
		int columns=(rows>0)?a[0].length:0;
		if ((rows<columns) || (columns==0)){
			throw new CRFException(CRFException.Kind.INVALID_PARAMETER,
					"SVD solver needs at least as many rows as columns, got "+rows+"x"+columns);
		}
		if (b.length!=rows){
			throw new CRFException(CRFException.Kind.DIMENSION_MISMATCH,
					"Right side has "+b.length+" elements, matrix has "+rows+" rows");
		}
		long startTime=System.nanoTime();
		SingularValueDecomposition svd;
		try {
			svd=new Matrix(a,rows,columns).svd();
		} catch (LinkageError e){
			throw new CRFException(CRFException.Kind.UNSUPPORTED_BACKEND, getName()+" is not available", e);
		}
		double [] s=svd.getSingularValues(); // descending
		double tolerance=Math.max(rows,columns)*s[0]*EPS;
		double [][] u=svd.getU().getArray(); // rows x columns
		double [][] v=svd.getV().getArray(); // columns x columns
		double [] utb=new double[columns];
		int rank=0;
		for (int j=0;j<columns;j++){
			if (s[j]<=tolerance) continue;
			rank++;
			double d=0.0;
			for (int i=0;i<rows;i++) d+=u[i][j]*b[i];
			utb[j]=d/s[j];
		}
		double [] x=new double[columns];
		for (int i=0;i<columns;i++){
			double d=0.0;
			for (int j=0;j<columns;j++) d+=v[i][j]*utb[j];
			x[i]=d;
		}
		if (this.debugLevel>1){
			System.out.println("JamaSVDSolver.solve(): "+rows+"x"+columns+", rank="+rank+
					", condition="+((s[columns-1]>0.0)?(s[0]/s[columns-1]):Double.POSITIVE_INFINITY)+
					", "+(0.000000001*(System.nanoTime()-startTime))+" sec");
		}
		return x;
	}
}
