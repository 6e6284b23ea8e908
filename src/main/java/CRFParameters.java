/**
** -----------------------------------------------------------------------------**
** CRFParameters.java
**
** Parameters of the camera response function calibration
**
**
** Copyright (C) 2014 Elphel, Inc.
**
** -----------------------------------------------------------------------------**
**
**  CRFParameters.java is free software: you can redistribute it and/or modify
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

import ij.gui.GenericDialog;

import java.util.Properties;

public class CRFParameters {
	public static final int DEFAULT_SAMPLES=256;

	public enum SamplingMode {
		PERCENTILE ("Percentile (Grossberg-Nayar), no registration needed"),
		SPATIAL    ("Spatial (Poisson disk), registered exposures only");
		private final String description;
		SamplingMode(String description) {this.description=description;}
		public String getDescription() {return this.description;}
	}

	public CRFWeightFunction weightFunction=CRFWeightFunction.DEB97;
	public SamplingMode samplingMode=       SamplingMode.PERCENTILE;
	public int     numSamples=              DEFAULT_SAMPLES; // <1 - use default
	public double  lambda=                  20.0;  // smoothness term strength
	public long    samplingSeed=            0;     // random seed for spatial sampling
	public int     filterSize=              11;    // RAW/JPEG curve smoothing window, 0 - no smoothing
	public boolean enforceMonotonic=        true;  // isotonic projection of the Debevec-Malik curves
	public boolean rawJpegMonotonic=        false; // isotonic projection of the RAW/JPEG median curves
	public int     threadsMax=              100;
	public int     debugLevel=              1;

	public CRFParameters(){}

	public CRFParameters(
			CRFWeightFunction weightFunction,
			int numSamples,
			double lambda){
		this.weightFunction=weightFunction;
		this.numSamples=numSamples;
		this.lambda=lambda;
	}

	/**
	 * Non-positive sample counts are replaced with the default, not rejected
	 * @return number of samples to use
	 */
	public int getNumSamples(){
		return (this.numSamples<1)?DEFAULT_SAMPLES:this.numSamples;
	}

	@Override
	public CRFParameters clone(){
		CRFParameters p=new CRFParameters();
		p.weightFunction=  this.weightFunction;
		p.samplingMode=    this.samplingMode;
		p.numSamples=      this.numSamples;
		p.lambda=          this.lambda;
		p.samplingSeed=    this.samplingSeed;
		p.filterSize=      this.filterSize;
		p.enforceMonotonic=this.enforceMonotonic;
		p.rawJpegMonotonic=this.rawJpegMonotonic;
		p.threadsMax=      this.threadsMax;
		p.debugLevel=      this.debugLevel;
		return p;
	}

	public void setProperties(String prefix,Properties properties){
		properties.setProperty(prefix+"weightFunction",  this.weightFunction.name());
		properties.setProperty(prefix+"samplingMode",    this.samplingMode.name());
		properties.setProperty(prefix+"numSamples",      this.numSamples+"");
		properties.setProperty(prefix+"lambda",          this.lambda+"");
		properties.setProperty(prefix+"samplingSeed",    this.samplingSeed+"");
		properties.setProperty(prefix+"filterSize",      this.filterSize+"");
		properties.setProperty(prefix+"enforceMonotonic",this.enforceMonotonic+"");
		properties.setProperty(prefix+"rawJpegMonotonic",this.rawJpegMonotonic+"");
		properties.setProperty(prefix+"threadsMax",      this.threadsMax+"");
		properties.setProperty(prefix+"debugLevel",      this.debugLevel+"");
	}

	public void getProperties(String prefix,Properties properties){
		if (properties.getProperty(prefix+"weightFunction")!=null)
			this.weightFunction=CRFWeightFunction.valueOf(properties.getProperty(prefix+"weightFunction"));
		if (properties.getProperty(prefix+"samplingMode")!=null)
			this.samplingMode=SamplingMode.valueOf(properties.getProperty(prefix+"samplingMode"));
		if (properties.getProperty(prefix+"numSamples")!=null)
			this.numSamples=Integer.parseInt(properties.getProperty(prefix+"numSamples"));
		if (properties.getProperty(prefix+"lambda")!=null)
			this.lambda=Double.parseDouble(properties.getProperty(prefix+"lambda"));
		if (properties.getProperty(prefix+"samplingSeed")!=null)
			this.samplingSeed=Long.parseLong(properties.getProperty(prefix+"samplingSeed"));
		if (properties.getProperty(prefix+"filterSize")!=null)
			this.filterSize=Integer.parseInt(properties.getProperty(prefix+"filterSize"));
		if (properties.getProperty(prefix+"enforceMonotonic")!=null)
			this.enforceMonotonic=Boolean.parseBoolean(properties.getProperty(prefix+"enforceMonotonic"));
		if (properties.getProperty(prefix+"rawJpegMonotonic")!=null)
			this.rawJpegMonotonic=Boolean.parseBoolean(properties.getProperty(prefix+"rawJpegMonotonic"));
		if (properties.getProperty(prefix+"threadsMax")!=null)
			this.threadsMax=Integer.parseInt(properties.getProperty(prefix+"threadsMax"));
		if (properties.getProperty(prefix+"debugLevel")!=null)
			this.debugLevel=Integer.parseInt(properties.getProperty(prefix+"debugLevel"));
	}

	public boolean showDialog(String title) {
		GenericDialog gd = new GenericDialog(title);
		String [] samplingDescriptions=new String[SamplingMode.values().length];
		for (int i=0;i<samplingDescriptions.length;i++) samplingDescriptions[i]=SamplingMode.values()[i].getDescription();
		gd.addChoice      ("Weight function",                        CRFWeightFunction.getDescriptions(), this.weightFunction.getDescription());
		gd.addChoice      ("Sampling of the exposure stack",         samplingDescriptions, this.samplingMode.getDescription());
		gd.addNumericField("Number of samples (<1 - use "+DEFAULT_SAMPLES+")", this.numSamples,0);
		gd.addNumericField("Smoothness term strength (lambda)",      this.lambda,3);
		gd.addNumericField("Random seed for spatial sampling",       this.samplingSeed,0);
		gd.addNumericField("RAW/JPEG curve smoothing window (0 - none)", this.filterSize,0);
		gd.addCheckbox    ("Force non-decreasing response curves",   this.enforceMonotonic);
		gd.addCheckbox    ("Force non-decreasing RAW/JPEG curves",   this.rawJpegMonotonic);
		gd.addNumericField("Maximal number of threads",              this.threadsMax,0);
		gd.addNumericField("Debug level",                            this.debugLevel,0);
		gd.showDialog();
		if (gd.wasCanceled()) return false;
		this.weightFunction=  CRFWeightFunction.values()[gd.getNextChoiceIndex()];
		this.samplingMode=    SamplingMode.values()[gd.getNextChoiceIndex()];
		this.numSamples=      (int) gd.getNextNumber();
		this.lambda=                gd.getNextNumber();
		this.samplingSeed=   (long) gd.getNextNumber();
		this.filterSize=      (int) gd.getNextNumber();
		this.enforceMonotonic=      gd.getNextBoolean();
		this.rawJpegMonotonic=      gd.getNextBoolean();
		this.threadsMax=      (int) gd.getNextNumber();
		this.debugLevel=      (int) gd.getNextNumber();
		return true;
	}
}
