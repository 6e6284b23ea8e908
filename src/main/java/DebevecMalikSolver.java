/**
** -----------------------------------------------------------------------------**
** DebevecMalikSolver.java
**
** Recovers inverse camera response from multiple exposures following
** P. Debevec, J. Malik, "Recovering High Dynamic Range Radiance Maps from
** Photographs", SIGGRAPH 1997
**
** Copyright (C) 2014 Elphel, Inc.
**
** -----------------------------------------------------------------------------**
**
**  DebevecMalikSolver.java is free software: you can redistribute it and/or modify
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

/**
 * For every sample i and exposure j with code z the model is g(z) = ln(E_i) + ln(t_j),
 * where g is the logarithm of the inverse response and E_i the (unknown) irradiance of
 * the sample. Unknowns are the 256 values of g followed by ln(E_i) of every sample.
 */
public class DebevecMalikSolver {
	public static final int CODES=     CRFWeightFunction.CODES;
	public static final int GAUGE_CODE=128; // g(GAUGE_CODE)=0

	private final LeastSquaresSolver solver;
	public int debugLevel=1;

	/** Assembled weighted system A*x=b */
	public static class LinearSystem {
		public final double [][] a;
		public final double []   b;
		public final int numSamples;
		LinearSystem(int rows, int columns, int numSamples){
			this.a=new double[rows][columns];
			this.b=new double[rows];
			this.numSamples=numSamples;
		}
		public int getRows()    {return this.a.length;}
		public int getColumns() {return this.a[0].length;}
		/**
		 * @param row equation index
		 * @return number of nonzero coefficients
		 */
		public int getNonZeros(int row){
			int n=0;
			for (int i=0;i<this.a[row].length;i++) if (this.a[row][i]!=0.0) n++;
			return n;
		}
	}

	public DebevecMalikSolver(LeastSquaresSolver solver){
		this.solver=solver;
	}

	public DebevecMalikSolver(LeastSquaresSolver solver, int debugLevel){
		this.solver=solver;
		this.debugLevel=debugLevel;
	}

	/**
	 * Fail early if there is nothing to solve with
	 * @throws CRFException UNSUPPORTED_BACKEND
	 */
	public void checkBackend() throws CRFException{
		if (this.solver==null){
			throw new CRFException(CRFException.Kind.UNSUPPORTED_BACKEND, "No least squares solver configured");
		}
		if (!this.solver.isAvailable()){
			throw new CRFException(CRFException.Kind.UNSUPPORTED_BACKEND, "Least squares solver "+this.solver.getName()+" is not available");
		}
	}

	/**
	 * Build the weighted system for one channel: data rows, one gauge row fixing g(128)=0
	 * and 254 smoothness rows penalizing the second derivative of g
	 * @param samples [sample][exposure] codes
	 * @param logExposures ln(t) per exposure
	 * @param weights 256 weights
	 * @param lambda smoothness strength
	 * @return system with numSamples*numExposures+1+254 rows and 256+numSamples columns
	 */
	public static LinearSystem buildSystem(
			int [][] samples,
			double [] logExposures,
			double [] weights,
			double lambda){
		int numSamples=samples.length;
		int numExposures=logExposures.length;
		int rows=numSamples*numExposures+1+(CODES-2);
		int columns=CODES+numSamples;
		LinearSystem system=new LinearSystem(rows, columns, numSamples);
		int k=0;
		for (int i=0;i<numSamples;i++){
			for (int j=0;j<numExposures;j++){
				int z=samples[i][j];
				double w=weights[z];
				system.a[k][z]=         w;
				system.a[k][CODES+i]=  -w;
				system.b[k]=            w*logExposures[j];
				k++;
			}
		}
		// removes the common offset of g and ln(E)
		system.a[k][GAUGE_CODE]=1.0;
		k++;
		for (int c=0;c<(CODES-2);c++){
			double wl=lambda*weights[c+1];
			system.a[k][c]=       wl;
			system.a[k][c+1]=-2.0*wl;
			system.a[k][c+2]=     wl;
			k++;
		}
		return system;
	}

	/**
	 * Solve one channel
	 * @param samples [sample][exposure] codes
	 * @param logExposures ln(t) per exposure
	 * @param weights 256 weights
	 * @param lambda smoothness strength
	 * @return 256 values of exp(g), not normalized
	 * @throws CRFException UNSUPPORTED_BACKEND when no solver is available
	 */
	public double [] solveChannel(
			int [][] samples,
			double [] logExposures,
			double [] weights,
			double lambda) throws CRFException {
		checkBackend();
		LinearSystem system=buildSystem(samples, logExposures, weights, lambda);
		if (this.debugLevel>1) System.out.println("DebevecMalikSolver.solveChannel(): matrix size "+system.getRows()+"x"+system.getColumns());
		double [] x=this.solver.solve(system.a, system.b);
		double [] icrf=new double[CODES];
		for (int i=0;i<CODES;i++) icrf[i]=Math.exp(x[i]);
		return icrf;
	}

	/**
	 * Solve every channel of the sample set independently
	 * @param sampleSet codes of the samples
	 * @param logExposures ln(t) per exposure
	 * @param weights 256 weights
	 * @param lambda smoothness strength
	 * @return [channel][256] not normalized inverse response
	 * @throws CRFException UNSUPPORTED_BACKEND when no solver is available,
	 * INVALID_PARAMETER for negative lambda or mismatched exposures
	 */
	public double [][] solve(
			CRFSubsampler.SampleSet sampleSet,
			double [] logExposures,
			double [] weights,
			double lambda) throws CRFException {
		checkBackend();
		if (!(lambda>=0.0)){
			throw new CRFException(CRFException.Kind.INVALID_PARAMETER, "Smoothness strength should be non-negative, got "+lambda);
		}
		if (logExposures.length!=sampleSet.getNumExposures()){
			throw new CRFException(CRFException.Kind.DIMENSION_MISMATCH, "Sample set has "+sampleSet.getNumExposures()+
					" exposures, got "+logExposures.length+" exposure times");
		}
		if (weights.length!=CODES){
			throw new CRFException(CRFException.Kind.INVALID_PARAMETER, "Weight table should have "+CODES+" entries, got "+weights.length);
		}
		double [][] icrf=new double[sampleSet.getNumChannels()][];
		for (int chn=0;chn<icrf.length;chn++){
			long startTime=System.nanoTime();
			icrf[chn]=solveChannel(sampleSet.getChannel(chn), logExposures, weights, lambda);
			if (this.debugLevel>0) System.out.println("Channel "+chn+": solved "+sampleSet.getNumSamples()+" samples x "+
					sampleSet.getNumExposures()+" exposures in "+(0.000000001*(System.nanoTime()-startTime))+" sec");
		}
		return icrf;
	}
}
