/**
** -----------------------------------------------------------------------------**
** CameraResponseFunction.java
**
** Per-channel inverse camera response (device code to relative irradiance)
**
**
** Copyright (C) 2014 Elphel, Inc.
**
** -----------------------------------------------------------------------------**
**
**  CameraResponseFunction.java is free software: you can redistribute it and/or modify
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

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;

import org.apache.commons.configuration.ConfigurationException;
import org.apache.commons.configuration.XMLConfiguration;

/**
 * Inverse camera response function: for every color channel a table of 256 relative
 * irradiance values indexed by device code. Instances are immutable, curves are copied
 * in and out, so one model can be shared by any number of threads applying it.
 */
public class CameraResponseFunction {
	public static final int CODES=CRFWeightFunction.CODES;
	public static final String ROOT_ELEMENT="cameraResponseFunction";

	public enum Source {DEBEVEC_MALIK, RAW_JPEG, LOADED}

	private final float [][] icrf;
	private final Source source;
	private final CRFWeightFunction weightFunction; // null if weights were not used

	/**
	 * @param icrf [channel][256] inverse response, copied
	 * @param source estimation method
	 * @param weightFunction weights used for estimation, may be null
	 */
	public CameraResponseFunction(float [][] icrf, Source source, CRFWeightFunction weightFunction){
		if ((icrf==null) || (icrf.length==0)) throw new IllegalArgumentException("Response function needs at least one channel");
		this.icrf=new float[icrf.length][];
		for (int chn=0;chn<icrf.length;chn++){
			if ((icrf[chn]==null) || (icrf[chn].length!=CODES)){
				throw new IllegalArgumentException("Channel "+chn+" should have "+CODES+" values");
			}
			this.icrf[chn]=icrf[chn].clone();
		}
		this.source=source;
		this.weightFunction=weightFunction;
	}

	/**
	 * Build model from estimated curves: optionally make them non-decreasing, then divide
	 * each channel by its maximum (when positive), so the maximum becomes exactly 1.0
	 * @param curves [channel][256] not normalized curves (not modified)
	 * @param source estimation method
	 * @param weightFunction weights used for estimation, may be null
	 * @param enforceMonotonic apply isotonic projection before normalization
	 * @return new model
	 */
	public static CameraResponseFunction normalized(
			double [][] curves,
			Source source,
			CRFWeightFunction weightFunction,
			boolean enforceMonotonic){
		float [][] icrf=new float[curves.length][CODES];
		for (int chn=0;chn<curves.length;chn++){
			double [] curve=enforceMonotonic?makeMonotonic(curves[chn]):curves[chn].clone();
			double max=curve[0];
			for (int i=1;i<CODES;i++) if (curve[i]>max) max=curve[i];
			if (max>0.0){
				for (int i=0;i<CODES;i++) curve[i]/=max;
			}
			for (int i=0;i<CODES;i++) icrf[chn][i]=(float) curve[i];
		}
		return new CameraResponseFunction(icrf, source, weightFunction);
	}

	public int getNumChannels()                   {return this.icrf.length;}
	public Source getSource()                     {return this.source;}
	public CRFWeightFunction getWeightFunction()  {return this.weightFunction;}
	public float getValue(int chn, int code)      {return this.icrf[chn][code];}

	/**
	 * @param chn color channel
	 * @return copy of the 256 values of the channel
	 */
	public float [] getCurve(int chn){
		return this.icrf[chn].clone();
	}

	public float getMax(int chn){
		float max=this.icrf[chn][0];
		for (int i=1;i<CODES;i++) if (this.icrf[chn][i]>max) max=this.icrf[chn][i];
		return max;
	}

	/**
	 * Inverse lookup in {@link CRFApplicator} relies on non-decreasing curves
	 * @param chn color channel
	 * @return true if the curve of the channel never decreases
	 */
	public boolean isMonotonic(int chn){
		for (int i=1;i<CODES;i++) if (this.icrf[chn][i]<this.icrf[chn][i-1]) return false;
		return true;
	}

	public boolean isMonotonic(){
		for (int chn=0;chn<this.icrf.length;chn++) if (!isMonotonic(chn)) return false;
		return true;
	}

	/**
	 * Closest (least squares) non-decreasing sequence, pool adjacent violators
	 * @param data input sequence, not modified
	 * @return non-decreasing sequence of the same length
	 */
	public static double [] makeMonotonic(double [] data){
		int n=data.length;
		double [] blockSum=   new double[n];
		int    [] blockLength=new int[n];
		int numBlocks=0;
		for (int i=0;i<n;i++){
			blockSum[numBlocks]=data[i];
			blockLength[numBlocks]=1;
			numBlocks++;
			while ((numBlocks>1) &&
					(blockSum[numBlocks-2]/blockLength[numBlocks-2] > blockSum[numBlocks-1]/blockLength[numBlocks-1])){
				blockSum[numBlocks-2]+=   blockSum[numBlocks-1];
				blockLength[numBlocks-2]+=blockLength[numBlocks-1];
				numBlocks--;
			}
		}
		double [] result=new double[n];
		int index=0;
		for (int nb=0;nb<numBlocks;nb++){
			double mean=blockSum[nb]/blockLength[nb];
			for (int i=0;i<blockLength[nb];i++) result[index++]=mean;
		}
		return result;
	}

	public void saveToXML(String pathname) throws IOException {
		saveToXML(pathname, null);
	}

	public void saveToXML(String pathname, String comment) throws IOException {
		XMLConfiguration hConfig=new XMLConfiguration();
		hConfig.setRootElementName(ROOT_ELEMENT);
		if (comment!=null) hConfig.addProperty("comment",comment);
		hConfig.addProperty("source",this.source.name());
		if (this.weightFunction!=null) hConfig.addProperty("weightFunction",this.weightFunction.name());
		hConfig.addProperty("channels",this.icrf.length);
		for (int chn=0;chn<this.icrf.length;chn++){
			StringBuilder sb=new StringBuilder();
			for (int i=0;i<CODES;i++){
				if (i>0) sb.append(' ');
				sb.append(Float.toString(this.icrf[chn][i]));
			}
			hConfig.addProperty("channel","");
			hConfig.addProperty("channel.index",chn);
			hConfig.addProperty("channel.icrf",sb.toString());
		}
		BufferedWriter writer=new BufferedWriter(new FileWriter(new File(pathname)));
		try {
			hConfig.save(writer);
		} catch (ConfigurationException e) {
			throw new IOException("Failed to save camera response to "+pathname, e);
		} finally {
			writer.close();
		}
	}

	/**
	 * Read model saved with {@link #saveToXML(String)}
	 * @param pathname file path
	 * @return model, source is the one recorded in the file
	 * @throws IOException file could not be read or parsed
	 * @throws CRFException file content is not a valid response function
	 */
	public static CameraResponseFunction loadFromXML(String pathname) throws IOException, CRFException {
		XMLConfiguration hConfig;
		try {
			hConfig=new XMLConfiguration(new File(pathname));
		} catch (ConfigurationException e) {
			throw new IOException("Failed to read camera response from "+pathname, e);
		}
		int numChannels=hConfig.getInt("channels",0);
		int numStored=hConfig.getMaxIndex("channel")+1;
		if ((numChannels<1) || (numStored!=numChannels)){
			throw new CRFException(CRFException.Kind.CHANNEL_COUNT_MISMATCH, pathname+" declares "+numChannels+
					" channels, contains "+numStored);
		}
		float [][] icrf=new float[numChannels][];
		for (int n=0;n<numChannels;n++){
			int chn=hConfig.getInt("channel("+n+").index",n);
			String values=hConfig.getString("channel("+n+").icrf");
			if ((chn<0) || (chn>=numChannels) || (icrf[chn]!=null) || (values==null)){
				throw new CRFException(CRFException.Kind.INVALID_PARAMETER, pathname+": invalid channel record "+n);
			}
			String [] tokens=values.trim().split("\\s+");
			if (tokens.length!=CODES){
				throw new CRFException(CRFException.Kind.INVALID_PARAMETER, pathname+": channel "+chn+" has "+tokens.length+
						" values, expected "+CODES);
			}
			icrf[chn]=new float[CODES];
			try {
				for (int i=0;i<CODES;i++) icrf[chn][i]=Float.parseFloat(tokens[i]);
			} catch (NumberFormatException e){
				throw new CRFException(CRFException.Kind.INVALID_PARAMETER, pathname+": channel "+chn+" has invalid value", e);
			}
		}
		CRFWeightFunction weightFunction=null;
		String weightName=hConfig.getString("weightFunction");
		if (weightName!=null){
			try {
				weightFunction=CRFWeightFunction.valueOf(weightName);
			} catch (IllegalArgumentException e){
				throw new CRFException(CRFException.Kind.INVALID_PARAMETER, pathname+": unknown weight function "+weightName, e);
			}
		}
		return new CameraResponseFunction(icrf, Source.LOADED, weightFunction);
	}
}
