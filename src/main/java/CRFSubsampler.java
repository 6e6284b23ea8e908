/**
** -----------------------------------------------------------------------------**
** CRFSubsampler.java
**
** Reduces exposure stack to a small set of (code, exposure) observations
**
**
** Copyright (C) 2014 Elphel, Inc.
**
** -----------------------------------------------------------------------------**
**
**  CRFSubsampler.java is free software: you can redistribute it and/or modify
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

public class CRFSubsampler {
	public int debugLevel=1;
	public int threadsMax=100;

	/**
	 * Device codes of the samples, [channel][sample][exposure]. Codes of one sample
	 * are expected to come from the same scene irradiance in every exposure.
	 */
	public static class SampleSet {
		private final int [][][] codes;
		private final int numSamples;
		private final int numExposures;

		public SampleSet(int [][][] codes, int numSamples, int numExposures){
			this.codes=codes;
			this.numSamples=numSamples;
			this.numExposures=numExposures;
		}
		public int getNumChannels()  {return this.codes.length;}
		public int getNumSamples()   {return this.numSamples;}
		public int getNumExposures() {return this.numExposures;}
		public int getCode(int chn, int sample, int nExp) {return this.codes[chn][sample][nExp];}
		/**
		 * @param chn color channel
		 * @return [sample][exposure] codes of the channel
		 */
		public int [][] getChannel(int chn) {return this.codes[chn];}
		public int size() {return getNumChannels()*this.numSamples*this.numExposures;}
	}

	public CRFSubsampler(){}
	public CRFSubsampler(int threadsMax, int debugLevel){
		this.threadsMax=threadsMax;
		this.debugLevel=debugLevel;
	}

	/**
	 * Select samples of the stack using the configured strategy
	 * @param exposureStack source images
	 * @param parameters sampling mode, number of samples and random seed
	 * @return sample set, number of samples may differ from requested for spatial sampling
	 * @throws CRFException INSUFFICIENT_DATA for an empty stack
	 */
	public SampleSet subsample(ExposureStack exposureStack, CRFParameters parameters) throws CRFException {
		switch (parameters.samplingMode){
		case PERCENTILE: return subsampleGrossberg(exposureStack, parameters.getNumSamples());
		case SPATIAL:    return subsampleSpatial(exposureStack, parameters.getNumSamples(), parameters.samplingSeed);
		default: throw new IllegalArgumentException("Unknown sampling mode "+parameters.samplingMode);
		}
	}

	/**
	 * Grossberg-Nayar sampling: the i-th sample of every exposure is the code at
	 * cumulative histogram level i/numSamples. Samples correspond by intensity rank,
	 * not by location, so exposures do not need to be registered.
	 * @param exposureStack source images
	 * @param numSamples number of samples, &lt;1 - use 256
	 * @return sample set with exactly numSamples samples
	 * @throws CRFException INSUFFICIENT_DATA for an empty stack
	 */
	public SampleSet subsampleGrossberg(ExposureStack exposureStack, int numSamples) throws CRFException {
		checkStack(exposureStack);
		if (numSamples<1) numSamples=CRFParameters.DEFAULT_SAMPLES;
		int numChannels= exposureStack.getNumChannels();
		int numExposures=exposureStack.getNumExposures();
		if (this.debugLevel>1) System.out.println("subsampleGrossberg(): computing "+(numChannels*numExposures)+" histograms");
		float [][][] cumulative=CRFHistograms.cumulativeHistograms(exposureStack, this.threadsMax);
		int [][][] codes=new int[numChannels][numSamples][numExposures];
		for (int chn=0;chn<numChannels;chn++){
			for (int i=0;i<numSamples;i++){
				float u=((float) i)/numSamples;
				for (int nExp=0;nExp<numExposures;nExp++){
					codes[chn][i][nExp]=upperBound(cumulative[chn][nExp], u);
				}
			}
		}
		if (this.debugLevel>1) System.out.println("subsampleGrossberg(): "+numSamples+" samples per channel");
		return new SampleSet(codes, numSamples, numExposures);
	}

	/**
	 * Spatial sampling: the same Poisson disk distributed pixels are read in every exposure.
	 * Exposures have to be registered.
	 * @param exposureStack source images
	 * @param numSamples requested number of samples, &lt;1 - use 256
	 * @param seed random seed of the point distribution
	 * @return sample set, {@link SampleSet#getNumSamples()} reports the achieved number
	 * @throws CRFException INSUFFICIENT_DATA for an empty stack or when no points were generated
	 */
	public SampleSet subsampleSpatial(ExposureStack exposureStack, int numSamples, long seed) throws CRFException {
		checkStack(exposureStack);
		if (numSamples<1) numSamples=CRFParameters.DEFAULT_SAMPLES;
		PoissonDiskSampler sampler=new PoissonDiskSampler(exposureStack.getWidth(), exposureStack.getHeight(), numSamples, seed);
		int achieved=sampler.getNumSamples();
		if (this.debugLevel>0) System.out.println("subsampleSpatial(): requested "+numSamples+" samples, generated "+achieved+
				" (minimal distance "+sampler.getMinDistance()+" pixels)");
		if (achieved<1){
			throw new CRFException(CRFException.Kind.INSUFFICIENT_DATA, "No sample points generated for "+
					exposureStack.getWidth()+"x"+exposureStack.getHeight()+" image");
		}
		int numChannels= exposureStack.getNumChannels();
		int numExposures=exposureStack.getNumExposures();
		int [][][] codes=new int[numChannels][achieved][numExposures];
		for (int chn=0;chn<numChannels;chn++){
			for (int i=0;i<achieved;i++){
				int [] xy=sampler.getPixel(i);
				for (int nExp=0;nExp<numExposures;nExp++){
					codes[chn][i][nExp]=exposureStack.getCode(chn, nExp, xy[0], xy[1]);
				}
			}
		}
		return new SampleSet(codes, achieved, numExposures);
	}

	/**
	 * Index of the first of the first 255 cumulative values that is strictly greater than u
	 * @param cumulative 256 ascending values
	 * @param u level in [0,1)
	 * @return code in [0,255], 255 if none is greater
	 */
	static int upperBound(float [] cumulative, float u){
		int low=0;
		int high=cumulative.length-1; // last bin excluded
		while (low<high){
			int mid=(low+high)>>>1;
			if (cumulative[mid]>u) high=mid;
			else low=mid+1;
		}
		if (low<0) return 0;
		if (low>ExposureStack.MAX_CODE) return ExposureStack.MAX_CODE;
		return low;
	}

	private static void checkStack(ExposureStack exposureStack) throws CRFException{
		if ((exposureStack==null) || (exposureStack.getNumExposures()<1)){
			throw new CRFException(CRFException.Kind.INSUFFICIENT_DATA, "Exposure stack is empty");
		}
	}
}
