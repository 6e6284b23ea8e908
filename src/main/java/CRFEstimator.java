/**
** -----------------------------------------------------------------------------**
** CRFEstimator.java
**
** Entry points of camera response function estimation
**
**
** Copyright (C) 2014 Elphel, Inc.
**
** -----------------------------------------------------------------------------**
**
**  CRFEstimator.java is free software: you can redistribute it and/or modify
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

import ij.IJ;
import ij.ImagePlus;

/**
 * Estimation of the inverse camera response. Each call builds a new
 * {@link CameraResponseFunction}; the estimator itself keeps no results, so a failed
 * call leaves nothing behind.
 */
public class CRFEstimator {
	private final CRFParameters parameters;
	private final LeastSquaresSolver solver;

	public CRFEstimator(){
		this(new CRFParameters());
	}

	public CRFEstimator(CRFParameters parameters){
		this(parameters, new JamaSVDSolver(parameters.debugLevel));
	}

	/**
	 * @param parameters estimation parameters (copied)
	 * @param solver least squares backend, null makes Debevec-Malik estimation fail with UNSUPPORTED_BACKEND
	 */
	public CRFEstimator(CRFParameters parameters, LeastSquaresSolver solver){
		this.parameters=parameters.clone();
		this.solver=solver;
	}

	public CRFParameters getParameters() {return this.parameters.clone();}

	/**
	 * Debevec-Malik estimation with explicit weights, sample count and smoothness,
	 * other settings from the parameters of this estimator
	 * @param exposureStack at least 2 exposures of a static scene
	 * @param weightFunction weights of the device codes
	 * @param numSamples number of samples per channel, &lt;1 - use 256
	 * @param lambda smoothness strength
	 * @return normalized response function, maximum of each channel is 1.0
	 * @throws CRFException INSUFFICIENT_DATA, UNSUPPORTED_BACKEND, INVALID_PARAMETER
	 */
	public CameraResponseFunction estimate(
			ExposureStack exposureStack,
			CRFWeightFunction weightFunction,
			int numSamples,
			double lambda) throws CRFException {
		CRFParameters p=this.parameters.clone();
		p.weightFunction=weightFunction;
		p.numSamples=numSamples;
		p.lambda=lambda;
		return estimate(exposureStack, p);
	}

	public CameraResponseFunction estimate(ExposureStack exposureStack) throws CRFException {
		return estimate(exposureStack, this.parameters);
	}

	private CameraResponseFunction estimate(ExposureStack exposureStack, CRFParameters p) throws CRFException {
		if ((exposureStack==null) || (exposureStack.getNumExposures()<1)){
			throw new CRFException(CRFException.Kind.INSUFFICIENT_DATA, "Exposure stack is empty");
		}
		if (exposureStack.getNumExposures()<2){
			throw new CRFException(CRFException.Kind.INSUFFICIENT_DATA, "Calibration needs at least 2 exposures, got "+
					exposureStack.getNumExposures());
		}
		if (p.weightFunction==null){
			throw new CRFException(CRFException.Kind.INVALID_PARAMETER, "Weight function is not specified");
		}
		DebevecMalikSolver dmSolver=new DebevecMalikSolver(this.solver, p.debugLevel);
		dmSolver.checkBackend();
		long startTime=System.nanoTime();
		IJ.showStatus("Sampling "+exposureStack.getNumExposures()+" exposures...");
		CRFSubsampler subsampler=new CRFSubsampler(p.threadsMax, p.debugLevel);
		CRFSubsampler.SampleSet sampleSet=subsampler.subsample(exposureStack, p);
		double [] weights=p.weightFunction.getTable();
		IJ.showStatus("Solving for camera response, "+sampleSet.getNumSamples()+" samples...");
		double [][] curves=dmSolver.solve(sampleSet, exposureStack.getLogExposures(), weights, p.lambda);
		CameraResponseFunction crf=CameraResponseFunction.normalized(
				curves,
				CameraResponseFunction.Source.DEBEVEC_MALIK,
				p.weightFunction,
				p.enforceMonotonic);
		IJ.showStatus("");
		if (p.debugLevel>0){
			System.out.println("Camera response estimated: "+crf.getNumChannels()+" channels, "+exposureStack.getNumExposures()+
					" exposures, "+sampleSet.getNumSamples()+" samples, weights "+p.weightFunction+", lambda="+p.lambda+
					" in "+IJ.d2s(0.000000001*(System.nanoTime()-startTime),3)+" sec");
		}
		return crf;
	}

	/**
	 * Solver-free estimation from a RAW/JPEG pair, smoothing window from parameters
	 * @param raw linear image
	 * @param jpeg camera processed image of the same scene
	 * @return response function
	 * @throws CRFException INSUFFICIENT_DATA, DIMENSION_MISMATCH
	 */
	public CameraResponseFunction estimateFromRawJpeg(ImagePlus raw, ImagePlus jpeg) throws CRFException {
		return estimateFromRawJpeg(raw, jpeg, this.parameters.filterSize);
	}

	public CameraResponseFunction estimateFromRawJpeg(ImagePlus raw, ImagePlus jpeg, int filterSize) throws CRFException {
		RawJpegEstimator rawJpegEstimator=new RawJpegEstimator(
				this.parameters.threadsMax,
				this.parameters.rawJpegMonotonic,
				this.parameters.debugLevel);
		return rawJpegEstimator.estimate(raw, jpeg, filterSize);
	}
}
